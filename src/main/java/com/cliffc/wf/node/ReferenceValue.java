package com.cliffc.wf.node;

import com.cliffc.wf.util.SB;

// The value of a form argument pulled back to the reference cell.  Only
// meaningful on a FormArgument terminal; that is checked by the passes that
// depend on it, not here.
public final class ReferenceValue extends Node {
  public ReferenceValue( Node f ) {
    super(Op.ReferenceValue,f);
    _shape = f._shape;
    _free  = f._free;
    _fdims = f._fdims;
    init();
  }
  @Override public Node reconstruct( Node[] ops ) { return new ReferenceValue(ops[0]); }
  @Override public SB str( SB sb ) { return _str(sb,"reference_value"); }
}
