package com.cliffc.wf.node;

import com.cliffc.wf.FormErr;

// Scalar rotation of a vector
public final class Rot extends CompoundDerivative {
  public Rot( Node f ) {
    super(Op.Rot,f);
    if( f.rank()!=1 ) throw FormErr.construct("Rot","Need a vector.");
    _shape = SCALAR;
    init();
  }
  @Override public Node reconstruct( Node[] ops ) { return new Rot(ops[0]); }
}
