package com.cliffc.wf.index;

import com.cliffc.wf.FormErr;
import com.cliffc.wf.util.SB;

// A literal axis position; takes part in no free/repeated bookkeeping.
public final class FixedIndex extends Idx {
  public final int _value;
  public FixedIndex( int value ) {
    if( value < 0 ) throw FormErr.construct("FixedIndex","Expecting a non-negative index, got "+value);
    _value = value;
  }
  @Override public boolean is_fixed() { return true; }
  @Override public SB str(SB sb) { return sb.p(_value); }
  @Override public boolean equals( Object o ) {
    return this==o || (o instanceof FixedIndex f && f._value==_value);
  }
  @Override public int hashCode() { return 0xf1dec0 ^ _value; }
}
