package com.cliffc.wf.node;

import com.cliffc.wf.FormErr;
import com.cliffc.wf.index.Idx;
import com.cliffc.wf.index.Index;
import com.cliffc.wf.index.Indices;
import com.cliffc.wf.util.Ary;
import com.cliffc.wf.util.SB;

import java.util.Arrays;

// as_tensor(expr, (i,j,...)): binds free indices of a scalar expression as
// the axes of a tensor.  The axes take the ranges of the bound indices.
public final class ComponentTensor extends Node {
  public ComponentTensor( Node expr, Node ii ) {
    super(Op.ComponentTensor,expr,ii);
    if( !(ii instanceof MultiIndex mi) ) throw FormErr.construct("ComponentTensor","Expecting a MultiIndex, got "+ii);
    if( expr.rank()!=0 ) throw FormErr.construct("ComponentTensor","Expecting scalar valued expression.");
    int[] shape = new int[mi.size()];
    for( int i=0; i<shape.length; i++ ) {
      Idx x = mi.at(i);
      int pos;
      if( !(x instanceof Index) || (pos=Indices.find(expr._free,x)) == -1 )
        throw FormErr.construct("ComponentTensor","Expecting free indices, "+x+" is not free in "+expr);
      for( int j=0; j<i; j++ )
        if( mi.at(j).equals(x) ) throw FormErr.construct("ComponentTensor","Index "+x+" bound twice");
      shape[i] = expr._fdims[pos];
    }
    // Remaining free indices
    Ary<Index> free = new Ary<>(Index.class);
    int[] fdims = new int[expr._free.length];
    Index[] bound = free_of(mi);
    for( int i=0; i<expr._free.length; i++ )
      if( Indices.find(bound,expr._free[i]) == -1 ) {
        fdims[free._len] = expr._fdims[i];
        free.push(expr._free[i]);
      }
    _shape = shape;
    _free  = free.asAry();
    _fdims = Arrays.copyOf(fdims,free._len);
    init();
  }
  private static Index[] free_of( MultiIndex mi ) {
    Index[] ids = new Index[mi.size()];
    for( int i=0; i<ids.length; i++ ) ids[i] = (Index)mi.at(i);
    return ids;
  }
  public MultiIndex multi_index() { return (MultiIndex)_ops[1]; }
  @Override public Node reconstruct( Node[] ops ) { return new ComponentTensor(ops[0],ops[1]); }
  @Override public SB str( SB sb ) { return _str(sb,"as_tensor"); }
}
