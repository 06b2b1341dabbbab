/*
 * Copyright 2026 Ben Manes. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.github.benmanes.rxcache.lock;

import static java.util.Objects.requireNonNull;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;
import java.util.function.Supplier;

import org.jspecify.annotations.Nullable;

import com.github.benmanes.rxcache.Lifecycle;
import com.github.benmanes.rxcache.ObjectDisposedException;
import com.google.errorprone.annotations.concurrent.GuardedBy;

import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Maybe;
import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.core.ObservableSource;
import io.reactivex.rxjava3.core.Observer;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.core.SingleObserver;
import io.reactivex.rxjava3.disposables.Disposable;
import io.reactivex.rxjava3.disposables.SerialDisposable;

/**
 * A reader/writer lock whose acquisitions complete asynchronously. Any number of readers may hold
 * the lock together, while a writer holds it alone. Requests are admitted from a single queue in
 * arrival order: the readers at the head are admitted together while no writer holds the lock, and
 * the writer at the head is admitted once nothing holds it. A queued writer therefore holds back
 * the readers that arrived after it.
 * <p>
 * A grant is represented by a {@link ReaderWriterLock} ticket that must be closed to release it.
 * A request that can be admitted immediately completes on the calling thread; otherwise it is
 * completed on the lock's {@link Executor} when an earlier grant is released. Cancelling a
 * pending request withdraws it from the queue.
 * <p>
 * The lock is not reentrant. Acquiring it again while holding a conflicting grant, for example
 * from within the work guarded by {@link #withWriterLock(Completable)}, never completes.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class AsyncReaderWriterLock implements AutoCloseable {
  static final Logger logger = System.getLogger(AsyncReaderWriterLock.class.getName());

  final CompletableFuture<Void> closeFuture;
  final Lifecycle lifecycle;
  final ReentrantLock lock;
  final Executor executor;

  @GuardedBy("lock")
  final Deque<Request> queue;
  @GuardedBy("lock")
  boolean writerActive;
  @GuardedBy("lock")
  int activeReaders;
  @GuardedBy("lock")
  long grants;

  /** Creates a lock that completes deferred grants on {@link ForkJoinPool#commonPool()}. */
  public AsyncReaderWriterLock() {
    this(ForkJoinPool.commonPool());
  }

  /**
   * Creates a lock that completes deferred grants on the given executor.
   *
   * @param executor the executor that completes the grants made when a ticket is released
   */
  public AsyncReaderWriterLock(Executor executor) {
    this.executor = requireNonNull(executor);
    this.lifecycle = new Lifecycle("AsyncReaderWriterLock");
    this.closeFuture = new CompletableFuture<>();
    this.lock = new ReentrantLock();
    this.queue = new ArrayDeque<>();
  }

  /* --------------- Acquisition --------------- */

  /**
   * Requests a shared grant.
   *
   * @return a future of the reader's ticket
   * @throws ObjectDisposedException if the lock has been closed
   */
  public CompletableFuture<ReaderWriterLock> acquireReaderLockAsync() {
    return acquireAsync(/* exclusive= */ false);
  }

  /**
   * Requests an exclusive grant.
   *
   * @return a future of the writer's ticket
   * @throws ObjectDisposedException if the lock has been closed
   */
  public CompletableFuture<ReaderWriterLock> acquireWriterLockAsync() {
    return acquireAsync(/* exclusive= */ true);
  }

  /**
   * Returns a {@link Single} that requests a shared grant when subscribed to. Disposing the
   * subscription before the grant is made withdraws the request.
   */
  public Single<ReaderWriterLock> acquireReaderLock() {
    return new AcquireSingle(this, /* exclusive= */ false);
  }

  /**
   * Returns a {@link Single} that requests an exclusive grant when subscribed to. Disposing the
   * subscription before the grant is made withdraws the request.
   */
  public Single<ReaderWriterLock> acquireWriterLock() {
    return new AcquireSingle(this, /* exclusive= */ true);
  }

  CompletableFuture<ReaderWriterLock> acquireAsync(boolean exclusive) {
    lifecycle.checkActive();
    return enqueue(exclusive);
  }

  CompletableFuture<ReaderWriterLock> enqueue(boolean exclusive) {
    var request = new Request(exclusive);
    List<Request> admitted;
    lock.lock();
    try {
      queue.add(request);
      admitted = admit();
    } finally {
      lock.unlock();
    }
    for (Request granted : admitted) {
      grant(granted);
    }
    if (!request.future.isDone()) {
      request.future.whenComplete((ticket, error) -> {
        if (request.future.isCancelled()) {
          reconcile();
        }
      });
    }
    return request.future;
  }

  /** Releases the grant held by the ticket and dispatches the requests that it unblocks. */
  void release(ReaderWriterLock ticket) {
    lock.lock();
    try {
      if (ticket.isExclusive()) {
        writerActive = false;
      } else {
        activeReaders--;
      }
    } finally {
      lock.unlock();
    }
    reconcile();
  }

  /** Admits the requests at the head of the queue that no longer conflict with the holders. */
  void reconcile() {
    List<Request> admitted;
    lock.lock();
    try {
      admitted = admit();
    } finally {
      lock.unlock();
    }
    for (Request granted : admitted) {
      dispatch(granted);
    }
  }

  @GuardedBy("lock")
  List<Request> admit() {
    List<Request> admitted = new ArrayList<>();
    for (;;) {
      Request head = queue.peek();
      if (head == null) {
        break;
      } else if (head.future.isDone()) {
        queue.poll();
        continue;
      }

      if (head.exclusive) {
        if (writerActive || (activeReaders > 0)) {
          break;
        }
        writerActive = true;
      } else if (writerActive) {
        break;
      } else {
        activeReaders++;
      }
      queue.poll();
      head.id = ++grants;
      admitted.add(head);
    }
    return admitted;
  }

  /** Completes the grant on the executor, or on this thread if the executor rejects it. */
  void dispatch(Request request) {
    try {
      executor.execute(() -> grant(request));
    } catch (RejectedExecutionException e) {
      logger.log(Level.WARNING, "Executor rejected the lock grant; completing it directly", e);
      grant(request);
    }
  }

  /** Hands the ticket to the requester, or releases it if the request was cancelled meanwhile. */
  void grant(Request request) {
    var ticket = new ReaderWriterLock(this, request.id, request.exclusive);
    if (!request.future.complete(ticket)) {
      ticket.close();
    }
  }

  /* --------------- Guarded work --------------- */

  /** Returns a {@link Single} that subscribes to {@code work} while holding a shared grant. */
  public <T> Single<T> withReaderLock(Single<T> work) {
    return locked(/* exclusive= */ false, work.toObservable()).singleOrError();
  }

  /** Returns a {@link Single} that subscribes to {@code work} while holding an exclusive grant. */
  public <T> Single<T> withWriterLock(Single<T> work) {
    return locked(/* exclusive= */ true, work.toObservable()).singleOrError();
  }

  /** Returns a {@link Maybe} that subscribes to {@code work} while holding a shared grant. */
  public <T> Maybe<T> withReaderLock(Maybe<T> work) {
    return locked(/* exclusive= */ false, work.toObservable()).singleElement();
  }

  /** Returns a {@link Maybe} that subscribes to {@code work} while holding an exclusive grant. */
  public <T> Maybe<T> withWriterLock(Maybe<T> work) {
    return locked(/* exclusive= */ true, work.toObservable()).singleElement();
  }

  /** Returns a {@link Completable} that subscribes to {@code work} while holding a shared grant. */
  public Completable withReaderLock(Completable work) {
    return locked(/* exclusive= */ false, work.toObservable()).ignoreElements();
  }

  /**
   * Returns a {@link Completable} that subscribes to {@code work} while holding an exclusive
   * grant.
   */
  public Completable withWriterLock(Completable work) {
    return locked(/* exclusive= */ true, work.toObservable()).ignoreElements();
  }

  /**
   * Returns an {@link Observable} that subscribes to {@code work} while holding a shared grant.
   * The grant is held until {@code work} terminates or the subscription is disposed.
   */
  public <T> Observable<T> withReaderLock(Observable<T> work) {
    return locked(/* exclusive= */ false, work);
  }

  /**
   * Returns an {@link Observable} that subscribes to {@code work} while holding an exclusive
   * grant. The grant is held until {@code work} terminates or the subscription is disposed.
   */
  public <T> Observable<T> withWriterLock(Observable<T> work) {
    return locked(/* exclusive= */ true, work);
  }

  /**
   * Runs {@code work} while holding a shared grant, releasing it when the returned stage
   * completes.
   *
   * @throws ObjectDisposedException if the lock has been closed
   */
  public <T> CompletableFuture<T> readAsync(Supplier<? extends CompletionStage<T>> work) {
    return lockedAsync(/* exclusive= */ false, work);
  }

  /**
   * Runs {@code work} while holding an exclusive grant, releasing it when the returned stage
   * completes.
   *
   * @throws ObjectDisposedException if the lock has been closed
   */
  public <T> CompletableFuture<T> writeAsync(Supplier<? extends CompletionStage<T>> work) {
    return lockedAsync(/* exclusive= */ true, work);
  }

  <T> CompletableFuture<T> lockedAsync(boolean exclusive,
      Supplier<? extends CompletionStage<T>> work) {
    requireNonNull(work);
    CompletableFuture<ReaderWriterLock> acquisition = acquireAsync(exclusive);
    CompletableFuture<T> result = acquisition.thenCompose(ticket -> {
      try {
        return work.get().whenComplete((value, error) -> ticket.close());
      } catch (RuntimeException | Error e) {
        ticket.close();
        throw e;
      }
    });
    result.whenComplete((value, error) -> {
      if (result.isCancelled()) {
        acquisition.cancel(/* mayInterruptIfRunning= */ false);
      }
    });
    return result;
  }

  <T> Observable<T> locked(boolean exclusive, ObservableSource<T> work) {
    requireNonNull(work);
    return Observable.create(emitter -> {
      CompletableFuture<ReaderWriterLock> acquisition = acquireAsync(exclusive);
      var upstream = new SerialDisposable(
          Disposable.fromFuture(acquisition, /* allowInterrupt= */ false));
      emitter.setDisposable(upstream);

      acquisition.whenComplete((ticket, error) -> {
        if (error != null) {
          emitter.tryOnError(error);
          return;
        }
        Observable.wrap(work).doFinally(ticket::close).subscribe(new Observer<T>() {
          @Override public void onSubscribe(Disposable d) {
            // disposes d, releasing the ticket, if the subscriber has already gone away
            upstream.replace(d);
          }
          @Override public void onNext(T value) {
            emitter.onNext(value);
          }
          @Override public void onError(Throwable e) {
            emitter.tryOnError(e);
          }
          @Override public void onComplete() {
            emitter.onComplete();
          }
        });
      });
    });
  }

  /* --------------- Inspection --------------- */

  /** Returns the number of readers holding the lock. */
  public int getReadLockCount() {
    lock.lock();
    try {
      return activeReaders;
    } finally {
      lock.unlock();
    }
  }

  /** Returns whether a writer holds the lock. */
  public boolean isWriteLocked() {
    lock.lock();
    try {
      return writerActive;
    } finally {
      lock.unlock();
    }
  }

  /** Returns the number of requests waiting to be admitted, including withdrawn ones. */
  public int getQueueLength() {
    lock.lock();
    try {
      return queue.size();
    } finally {
      lock.unlock();
    }
  }

  /* --------------- Lifecycle --------------- */

  /** Returns whether {@link #close()} has been called. */
  public boolean isDisposed() {
    return lifecycle.isDisposed();
  }

  /** Returns a future that completes once the work admitted before {@link #close()} finished. */
  public CompletableFuture<Void> closeFuture() {
    return closeFuture.copy();
  }

  /**
   * Rejects new acquisitions and disposes the lock once the grants made or queued before this call
   * have been released. This method does not wait; see {@link #closeFuture()}.
   */
  @Override
  @SuppressWarnings("FutureReturnValueIgnored")
  public void close() {
    if (!lifecycle.beginDisposal()) {
      return;
    }
    enqueue(/* exclusive= */ true).thenAccept(ticket -> {
      ticket.close();
      lifecycle.completeDisposal();
      closeFuture.complete(null);
      logger.log(Level.DEBUG, "Disposed lock after {0} grants", ticket.id());
    });
  }

  @Override
  public String toString() {
    lock.lock();
    try {
      return getClass().getSimpleName() + "{readers=" + activeReaders + ", writer=" + writerActive
          + ", queued=" + queue.size() + ", " + lifecycle.state() + "}";
    } finally {
      lock.unlock();
    }
  }

  static final class Request {
    final CompletableFuture<ReaderWriterLock> future;
    final boolean exclusive;
    long id;

    Request(boolean exclusive) {
      this.future = new CompletableFuture<>();
      this.exclusive = exclusive;
    }
  }

  /** A cold acquisition that releases a grant arriving after the subscriber has gone away. */
  static final class AcquireSingle extends Single<ReaderWriterLock> {
    final AsyncReaderWriterLock owner;
    final boolean exclusive;

    AcquireSingle(AsyncReaderWriterLock owner, boolean exclusive) {
      this.exclusive = exclusive;
      this.owner = owner;
    }

    @Override
    protected void subscribeActual(SingleObserver<? super ReaderWriterLock> observer) {
      CompletableFuture<ReaderWriterLock> future;
      try {
        future = owner.acquireAsync(exclusive);
      } catch (ObjectDisposedException e) {
        observer.onSubscribe(Disposable.disposed());
        observer.onError(e);
        return;
      }
      var acquisition = new Acquisition(observer, future);
      observer.onSubscribe(acquisition);
      future.whenComplete(acquisition);
    }
  }

  @SuppressWarnings("serial")
  static final class Acquisition extends AtomicInteger
      implements Disposable, BiConsumer<ReaderWriterLock, Throwable> {
    static final int WAITING = 0;
    static final int DELIVERED = 1;
    static final int DISPOSED = 2;

    final SingleObserver<? super ReaderWriterLock> downstream;
    final CompletableFuture<ReaderWriterLock> future;

    Acquisition(SingleObserver<? super ReaderWriterLock> downstream,
        CompletableFuture<ReaderWriterLock> future) {
      this.downstream = downstream;
      this.future = future;
    }

    @Override
    public void accept(@Nullable ReaderWriterLock ticket, @Nullable Throwable error) {
      if (compareAndSet(WAITING, DELIVERED)) {
        if (error == null) {
          downstream.onSuccess(requireNonNull(ticket));
        } else {
          downstream.onError(error);
        }
      } else if (ticket != null) {
        ticket.close();
      }
    }

    @Override
    public void dispose() {
      if (compareAndSet(WAITING, DISPOSED)) {
        future.cancel(/* mayInterruptIfRunning= */ false);
      }
    }

    @Override
    public boolean isDisposed() {
      return (get() == DISPOSED);
    }
  }
}
