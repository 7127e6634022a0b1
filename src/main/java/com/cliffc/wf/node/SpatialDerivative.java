package com.cliffc.wf.node;

import com.cliffc.wf.FormErr;
import com.cliffc.wf.index.FixedIndex;
import com.cliffc.wf.index.Idx;
import com.cliffc.wf.index.Index;
import com.cliffc.wf.index.Indices;
import com.cliffc.wf.sig.Renumbering;
import com.cliffc.wf.util.SB;

import java.util.LinkedHashMap;

/** Partial derivative of an expression w.r.t. the spatial directions given
 *  by a MultiIndex: {@code f.dx(i,j)}.
 *
 *  Derivative indices range over the spatial dimension.  Free and repeated
 *  indices are extracted from the combined context of the expression's free
 *  indices followed by the derivative indices, so an index appearing twice
 *  (once in each, or twice among the derivative indices) is summed.  The
 *  shape is the expression's shape.
 */
public final class SpatialDerivative extends Node {
  final int _dim;               // Spatial dimension
  private final Indices _ix;
  public SpatialDerivative( Node expr, Node ii, int dim ) {
    super(Op.SpatialDerivative,expr,ii);
    if( !(ii instanceof MultiIndex mi) ) throw FormErr.construct("SpatialDerivative","Expecting a MultiIndex, got "+ii);
    if( dim < 1 ) throw FormErr.construct("SpatialDerivative","Spatial dimension must be positive, got "+dim);
    for( Idx x : mi._ids )
      if( x instanceof FixedIndex f && f._value >= dim )
        throw FormErr.construct("SpatialDerivative","Fixed index "+f._value+" out of bounds for spatial dimension "+dim);
    _dim = dim;
    _ix = Indices.extract(expr._free,expr._fdims,mi._ids,dim);
    _shape = expr._shape;
    _free  = _ix._free;
    _fdims = _ix._free_dims;
    init();
  }
  public Node expression() { return _ops[0]; }
  public MultiIndex multi_index() { return (MultiIndex)_ops[1]; }
  public int dim() { return _dim; }
  public Index[] repeated_indices() { return _ix._repeated.clone(); }

  // Repeated indices always iterate over the spatial range
  public LinkedHashMap<Index,Integer> repeated_index_dimensions() {
    LinkedHashMap<Index,Integer> d = new LinkedHashMap<>();
    for( Index i : _ix._repeated ) d.put(i,_dim);
    return d;
  }

  @Override int payload_hash() { return _dim; }
  @Override boolean eq_payload( Node n ) { return _dim==((SpatialDerivative)n)._dim; }
  @Override Object[] signature_payload( Renumbering r ) { return new Object[]{_dim}; }
  @Override public Node reconstruct( Node[] ops ) { return new SpatialDerivative(ops[0],ops[1],_dim); }
  @Override public SB str( SB sb ) {
    return _ops[1].str(_ops[0].str(sb.p("(d[")).p("] / dx_")).p(')');
  }
}
