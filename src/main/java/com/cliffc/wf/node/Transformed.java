package com.cliffc.wf.node;

import com.cliffc.wf.FormErr;
import com.cliffc.wf.util.SB;

// Deferred application of a TransformOp to a fully evaluated expression.
// See ApplyTransforms for how these get pushed down to the leaves.
public final class Transformed extends Node {
  public Transformed( Node expr, Node op ) {
    super(Op.Transformed,expr,op);
    if( !(op instanceof TransformOp) ) throw FormErr.construct("Transformed","Expecting a TransformOp, got "+op);
    _shape = expr._shape;
    _free  = expr._free;
    _fdims = expr._fdims;
    init();
  }
  public Node expression() { return _ops[0]; }
  public TransformOp transform_op() { return (TransformOp)_ops[1]; }
  @Override public Node reconstruct( Node[] ops ) { return new Transformed(ops[0],ops[1]); }
  @Override public SB str( SB sb ) { return _str(sb,"transformed"); }
}
