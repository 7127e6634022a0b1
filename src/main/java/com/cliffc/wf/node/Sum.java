package com.cliffc.wf.node;

import com.cliffc.wf.FormErr;
import com.cliffc.wf.index.Indices;
import com.cliffc.wf.util.SB;

import java.util.Arrays;

public final class Sum extends Node {
  public Sum( Node a, Node b ) {
    super(Op.Sum,a,b);
    if( !Arrays.equals(a._shape,b._shape) )
      throw FormErr.construct("Sum","Can't add expressions with different shapes.");
    if( !Indices.same_set(a._free,b._free) )
      throw FormErr.construct("Sum","Can't add expressions with different free indices.");
    _shape = a._shape;
    _free  = a._free;
    _fdims = a._fdims;
    init();
  }
  @Override public Node reconstruct( Node[] ops ) { return new Sum(ops[0],ops[1]); }
  @Override public SB str( SB sb ) {
    _ops[0].str(sb.p('(')).p(" + ");
    return _ops[1].str(sb).p(')');
  }
}
