package com.cliffc.wf.node;

import com.cliffc.wf.FormErr;
import com.cliffc.wf.Forms;
import com.cliffc.wf.index.Idx;
import com.cliffc.wf.index.Index;
import com.cliffc.wf.sig.Renumbering;
import com.cliffc.wf.util.Util;

// Gradient.  Prepends a spatial axis of size dim to the operand's shape.
public final class Grad extends CompoundDerivative {
  final int _dim;
  public Grad( Node f, int dim ) {
    super(Op.Grad,f);
    if( dim < 1 ) throw FormErr.construct("Grad","Spatial dimension must be positive, got "+dim);
    _dim = dim;
    _shape = Util.cat(dim,f._shape);
    init();
  }
  public int dim() { return _dim; }

  // as_tensor(f[j..].dx(i), (i,j..))
  @Override public Node as_basic( Forms forms, Node f ) {
    Index i = forms.index();
    if( f.rank()==0 )
      return new ComponentTensor(new SpatialDerivative(f,new MultiIndex(i),_dim),new MultiIndex(i));
    Index[] jj = forms.indices(f.rank());
    Idx[] ij = new Idx[jj.length+1];
    ij[0] = i;
    System.arraycopy(jj,0,ij,1,jj.length);
    Node fj = new Indexed(f,new MultiIndex(jj));
    return new ComponentTensor(new SpatialDerivative(fj,new MultiIndex(i),_dim),new MultiIndex(ij));
  }

  @Override int payload_hash() { return _dim; }
  @Override boolean eq_payload( Node n ) { return _dim==((Grad)n)._dim; }
  @Override Object[] signature_payload( Renumbering r ) { return new Object[]{_dim}; }
  @Override public Node reconstruct( Node[] ops ) { return new Grad(ops[0],_dim); }
}
