package com.cliffc.wf.node;

import com.cliffc.wf.FormErr;
import com.cliffc.wf.index.FixedIndex;
import com.cliffc.wf.index.Idx;
import com.cliffc.wf.index.Index;
import com.cliffc.wf.index.Indices;
import com.cliffc.wf.sig.Renumbering;
import com.cliffc.wf.sig.Tup;
import com.cliffc.wf.util.SB;

import java.util.Arrays;

// An ordered tuple of indices, carried as an operand by Indexed,
// ComponentTensor and SpatialDerivative.  Free-index bookkeeping belongs to
// the node using it, so a MultiIndex reports none of its own.
public final class MultiIndex extends Terminal {
  final Idx[] _ids;
  public MultiIndex( Idx... ids ) {
    super(Op.MultiIndex);
    for( Idx i : ids ) if( i==null ) throw FormErr.construct("MultiIndex","Expecting indices");
    _ids = ids.clone();
    _shape = SCALAR;
    init();
  }
  public int size() { return _ids.length; }
  public Idx at( int i ) { return _ids[i]; }
  public Idx[] indices() { return _ids.clone(); }

  @Override int payload_hash() { return Arrays.hashCode(_ids); }
  @Override boolean eq_payload( Node n ) { return Arrays.equals(_ids,((MultiIndex)n)._ids); }

  // Symbolic indices are renumbered by first appearance
  @Override public Tup signature_data( Renumbering r, Tup[] ops ) {
    Object[] es = new Object[_ids.length];
    for( int i=0; i<es.length; i++ )
      es[i] = _ids[i] instanceof Index idx
        ? Tup.make("Index",r.index(idx))
        : Tup.make("FixedIndex",((FixedIndex)_ids[i])._value);
    return Tup.make("MultiIndex",es);
  }
  @Override public SB str( SB sb ) { return Indices.str(sb,_ids); }
}
