package com.cliffc.wf.index;

import com.cliffc.wf.util.SB;

// One entry of a MultiIndex: either a symbolic Index or a FixedIndex.
public abstract class Idx {
  Idx() {}
  public abstract boolean is_fixed();
  public abstract SB str(SB sb);
  @Override public final String toString() { return str(new SB()).toString(); }
}
