package com.cliffc.wf.node;

import com.cliffc.wf.FormErr;
import com.cliffc.wf.sig.Renumbering;

// Curl of a vector; the result is a vector of the spatial dimension.
public final class Curl extends CompoundDerivative {
  final int _dim;
  public Curl( Node f, int dim ) {
    super(Op.Curl,f);
    if( f.rank()!=1 ) throw FormErr.construct("Curl","Need a vector.");
    if( dim < 1 ) throw FormErr.construct("Curl","Spatial dimension must be positive, got "+dim);
    _dim = dim;
    _shape = new int[]{dim};
    init();
  }
  public int dim() { return _dim; }
  @Override int payload_hash() { return _dim; }
  @Override boolean eq_payload( Node n ) { return _dim==((Curl)n)._dim; }
  @Override Object[] signature_payload( Renumbering r ) { return new Object[]{_dim}; }
  @Override public Node reconstruct( Node[] ops ) { return new Curl(ops[0],_dim); }
}
