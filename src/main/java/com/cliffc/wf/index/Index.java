package com.cliffc.wf.index;

import com.cliffc.wf.util.Counted;
import com.cliffc.wf.util.SB;

// Symbolic index.  Free if it occurs once in an index context, repeated (and
// implicitly summed) if it occurs twice.
public final class Index extends Idx implements Counted {
  public final int _count;
  public Index( int count ) { _count = count; }
  @Override public int count() { return _count; }
  @Override public boolean is_fixed() { return false; }
  @Override public SB str(SB sb) { return sb.p("i_").p(_count); }
  @Override public boolean equals( Object o ) {
    return this==o || (o instanceof Index i && i._count==_count);
  }
  @Override public int hashCode() { return 0x1dec0de ^ _count; }
}
