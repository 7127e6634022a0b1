package com.cliffc.wf.node;

import com.cliffc.wf.FormErr;
import com.cliffc.wf.index.Index;
import com.cliffc.wf.index.Indices;
import com.cliffc.wf.util.SB;
import com.cliffc.wf.util.Util;

// d f / d x, for a Variable x.  Shape is f's shape followed by x's shape.
// Free indices of f and x are concatenated and must not overlap: a shared
// index would make the contraction target ambiguous.
public final class Diff extends Node {
  public Diff( Node f, Node x ) {
    super(Op.Diff,f,x);
    if( !(x instanceof Variable) ) throw FormErr.construct("Diff","Expecting a Variable in Diff.");
    if( Indices.intersects(f._free,x._free) )
      throw FormErr.construct("Diff","Repeated indices not allowed in Diff.");
    _shape = Util.cat(f._shape,x._shape);
    Index[] free = new Index[f._free.length+x._free.length];
    System.arraycopy(f._free,0,free,0,f._free.length);
    System.arraycopy(x._free,0,free,f._free.length,x._free.length);
    _free  = free;
    _fdims = Util.cat(f._fdims,x._fdims);
    init();
  }
  public Node f() { return _ops[0]; }
  public Variable variable() { return (Variable)_ops[1]; }
  @Override public Node reconstruct( Node[] ops ) { return new Diff(ops[0],ops[1]); }
  @Override public SB str( SB sb ) {
    _ops[0].str(sb.p("(d[")).p("] / d[");
    return _ops[1].str(sb).p("])");
  }
}
