package com.cliffc.wf.node;

import com.cliffc.wf.FormErr;
import com.cliffc.wf.index.Idx;
import com.cliffc.wf.index.Index;
import com.cliffc.wf.index.Indices;
import com.cliffc.wf.util.SB;
import com.cliffc.wf.util.Util;

// Scalar product.  An index free in both factors is repeated, and summed.
public final class Product extends Node {
  private final Indices _ix;
  public Product( Node a, Node b ) {
    super(Op.Product,a,b);
    if( a.rank()!=0 || b.rank()!=0 )
      throw FormErr.construct("Product","Product can only represent products of scalars.");
    Idx[] ids = new Idx[a._free.length+b._free.length];
    System.arraycopy(a._free,0,ids,0,a._free.length);
    System.arraycopy(b._free,0,ids,a._free.length,b._free.length);
    _ix = Indices.extract(ids,Util.cat(a._fdims,b._fdims));
    _shape = SCALAR;
    _free  = _ix._free;
    _fdims = _ix._free_dims;
    init();
  }
  public Index[] repeated_indices() { return _ix._repeated.clone(); }
  @Override public Node reconstruct( Node[] ops ) { return new Product(ops[0],ops[1]); }
  @Override public SB str( SB sb ) {
    _ops[0].str(sb.p('(')).p(" * ");
    return _ops[1].str(sb).p(')');
  }
}
