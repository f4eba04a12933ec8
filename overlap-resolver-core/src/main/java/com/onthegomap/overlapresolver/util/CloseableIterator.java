package com.onthegomap.overlapresolver.util;

import java.io.Closeable;
import java.util.Iterator;
import java.util.List;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/** An {@link Iterator} over a source that may hold resources until it is closed. */
public interface CloseableIterator<T> extends Closeable, Iterator<T> {

  /** Returns an iterator over {@code items} that holds no resources. */
  static <T> CloseableIterator<T> of(List<T> items) {
    return of(items.stream());
  }

  static <T> CloseableIterator<T> of(Stream<T> stream) {
    return new CloseableIterator<>() {
      private final Iterator<T> iter = stream.iterator();

      @Override
      public boolean hasNext() {
        return iter.hasNext();
      }

      @Override
      public T next() {
        return iter.next();
      }

      @Override
      public void close() {
        stream.close();
      }
    };
  }

  @Override
  void close();

  default Stream<T> stream() {
    return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, 0), false).onClose(this::close);
  }
}
