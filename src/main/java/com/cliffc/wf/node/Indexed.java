package com.cliffc.wf.node;

import com.cliffc.wf.FormErr;
import com.cliffc.wf.index.FixedIndex;
import com.cliffc.wf.index.Idx;
import com.cliffc.wf.index.Index;
import com.cliffc.wf.index.Indices;
import com.cliffc.wf.util.SB;

// A[i,j,...]: one index per axis of A, giving a scalar.  Each symbolic index
// ranges over its axis; one that is also free in A is repeated and summed.
public final class Indexed extends Node {
  private final Indices _ix;
  public Indexed( Node A, Node ii ) {
    super(Op.Indexed,A,ii);
    if( !(ii instanceof MultiIndex mi) ) throw FormErr.construct("Indexed","Expecting a MultiIndex, got "+ii);
    if( mi.size() != A.rank() )
      throw FormErr.construct("Indexed","Invalid number of indices ("+mi.size()+") for tensor expression of rank "+A.rank());
    int nf = A._free.length;
    Idx[] ids = new Idx[nf+mi.size()];
    int[] dims = new int[ids.length];
    System.arraycopy(A._free,0,ids,0,nf);
    System.arraycopy(A._fdims,0,dims,0,nf);
    for( int i=0; i<mi.size(); i++ ) {
      Idx x = mi.at(i);
      if( x instanceof FixedIndex f && f._value >= A._shape[i] )
        throw FormErr.construct("Indexed","Fixed index "+f._value+" out of bounds for axis of size "+A._shape[i]);
      ids [nf+i] = x;
      dims[nf+i] = A._shape[i];
    }
    _ix = Indices.extract(ids,dims);
    _shape = SCALAR;
    _free  = _ix._free;
    _fdims = _ix._free_dims;
    init();
  }
  public MultiIndex multi_index() { return (MultiIndex)_ops[1]; }
  public Index[] repeated_indices() { return _ix._repeated.clone(); }
  @Override public Node reconstruct( Node[] ops ) { return new Indexed(ops[0],ops[1]); }
  @Override public SB str( SB sb ) { return _ops[1].str(_ops[0].str(sb).p('[')).p(']'); }
}
