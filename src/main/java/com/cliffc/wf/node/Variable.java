package com.cliffc.wf.node;

import com.cliffc.wf.FormErr;
import com.cliffc.wf.util.SB;
import com.cliffc.wf.util.Util;

/** A labelled stand-in for another expression.
 *
 *  Used as the target of Diff, and internally to mark sub-expressions worth
 *  computing once.  Shape and free indices are those of the wrapped
 *  expression.  Two variables are equal iff their labels have the same
 *  count, whatever they wrap.
 */
public final class Variable extends Node {
  public Variable( Node expr, Node label ) {
    super(Op.Variable,expr,label);
    if( !(label instanceof Label) ) throw FormErr.construct("Variable","Expecting a Label.");
    _shape = expr._shape;
    _free  = expr._free;
    _fdims = expr._fdims;
    init();
  }
  public Node expression() { return _ops[0]; }
  public Label label() { return (Label)_ops[1]; }

  @Override public Node reconstruct( Node[] ops ) { return new Variable(ops[0],ops[1]); }

  @Override int compute_hash() { return Util.mix_hash(_op.ordinal()+1,label()._count); }
  @Override public boolean equals( Object o ) {
    return this==o || (o instanceof Variable v && v.label()._count==label()._count);
  }
  @Override public int hashCode() { return super.hashCode(); }

  @Override public SB str( SB sb ) { return _str(sb,"Variable"); }
}
