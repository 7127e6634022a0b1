package com.cliffc.wf.util;

import java.util.concurrent.atomic.AtomicInteger;

// Monotonic id allocator.  One per kind of counted entity, owned by a
// construction context.  Explicitly claimed ids bump the allocator past
// them, so later automatic ids never collide with a claimed one.
public final class Counter {
  private final AtomicInteger _next;
  public Counter() { this(0); }
  public Counter( int start ) { _next = new AtomicInteger(start); }

  // Hand out the next id
  public int next() { return _next.getAndIncrement(); }

  // Claim a specific id; null means "allocate one"
  public int claim( Integer count ) {
    if( count==null ) return next();
    int c = count;
    _next.accumulateAndGet(c+1,Math::max);
    return c;
  }

  @Override public String toString() { return "next="+_next.get(); }
}
