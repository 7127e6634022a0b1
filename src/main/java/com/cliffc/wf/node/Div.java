package com.cliffc.wf.node;

import com.cliffc.wf.FormErr;
import com.cliffc.wf.Forms;
import com.cliffc.wf.index.Idx;
import com.cliffc.wf.index.Index;

import java.util.Arrays;

// Divergence.  Contracts the leading axis of the operand with a spatial
// derivative, so the shape drops that axis.
public final class Div extends CompoundDerivative {
  public Div( Node f ) {
    super(Op.Div,f);
    if( f.rank()==0 ) throw FormErr.construct("Div","Can't take the divergence of a scalar.");
    _shape = Arrays.copyOfRange(f._shape,1,f._shape.length);
    init();
  }

  // f[i].dx(i), or as_tensor(f[i,j..].dx(i), (j..)).  The summed index
  // ranges over the leading axis, which must match the spatial dimension.
  @Override public Node as_basic( Forms forms, Node f ) {
    int dim = forms.dim();
    if( f._shape[0] != dim )
      throw FormErr.construct("Div","Leading axis of length "+f._shape[0]+" does not match spatial dimension "+dim);
    Index i = forms.index();
    if( f.rank()==1 )
      return new SpatialDerivative(new Indexed(f,new MultiIndex(i)),new MultiIndex(i),dim);
    Index[] jj = forms.indices(f.rank()-1);
    Idx[] ij = new Idx[f.rank()];
    ij[0] = i;
    System.arraycopy(jj,0,ij,1,jj.length);
    Node fij = new Indexed(f,new MultiIndex(ij));
    return new ComponentTensor(new SpatialDerivative(fij,new MultiIndex(i),dim),new MultiIndex(jj));
  }

  @Override public Node reconstruct( Node[] ops ) { return new Div(ops[0]); }
}
