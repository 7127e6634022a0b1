package com.cliffc.wf.node;

import com.cliffc.wf.FormErr;
import com.cliffc.wf.Forms;
import com.cliffc.wf.util.SB;

// Grad, Div, Curl and Rot: differential operators on a whole tensor-valued
// expression, with no free indices of their own.  Some of them can be
// lowered to index notation with as_basic.
public abstract class CompoundDerivative extends Node {
  CompoundDerivative( Op op, Node f ) {
    super(op,f);
    if( f.has_free() )
      throw FormErr.construct(op.name(),"Taking "+op.name().toLowerCase()+" of an expression with free indices is not supported.");
    _free  = f._free;
    _fdims = f._fdims;
  }
  public Node f() { return _ops[0]; }

  // Lower this operator, applied to the (already lowered) operand f, into
  // Indexed/SpatialDerivative/ComponentTensor nodes.  Fresh indices come
  // from the Forms context.
  public Node as_basic( Forms forms, Node f ) {
    throw FormErr.traverse(_op.name()+" has no basic-operator lowering");
  }

  @Override public SB str( SB sb ) { return _str(sb,_op.name().toLowerCase()); }
}
