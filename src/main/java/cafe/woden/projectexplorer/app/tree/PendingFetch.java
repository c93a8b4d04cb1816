package cafe.woden.projectexplorer.app.tree;

import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.subjects.CompletableSubject;

/**
 * The single in-flight fetch of a node, shared by every caller that asks while it runs.
 *
 * <p>Once the fetch settles its outcome is kept, so a caller subscribing late gets that outcome
 * instead of a second backend request.
 */
final class PendingFetch {

  final CompletableSubject cancellation = CompletableSubject.create();
  Single<NodeChildren> result;

  private volatile NodeChildren value;
  private volatile Throwable error;
  private volatile boolean abandoned;

  void cancel() {
    cancellation.onComplete();
  }

  void succeeded(NodeChildren children) {
    this.value = children;
  }

  void failed(Throwable err) {
    this.error = err;
  }

  void abandon() {
    this.abandoned = true;
  }

  boolean isAbandoned() {
    return abandoned && value == null && error == null;
  }

  /** The settled outcome, or {@code null} while the fetch still runs. */
  Single<NodeChildren> settled() {
    NodeChildren v = value;
    if (v != null) return Single.just(v);
    Throwable e = error;
    if (e != null) return Single.error(e);
    return null;
  }
}
