package com.cliffc.wf.node;

import com.cliffc.wf.sig.Renumbering;
import com.cliffc.wf.sig.Tup;
import com.cliffc.wf.util.Counted;
import com.cliffc.wf.util.SB;

// An opaque counted name; tags a Variable.
public final class Label extends Terminal implements Counted {
  final int _count;
  public Label( int count ) {
    super(Op.Label);
    _count = count;
    _shape = SCALAR;
    init();
  }
  @Override public int count() { return _count; }
  @Override int payload_hash() { return _count; }
  @Override boolean eq_payload( Node n ) { return _count==((Label)n)._count; }
  // Labels left out of the renumbering keep their raw count
  @Override public Tup signature_data( Renumbering r, Tup[] ops ) {
    Integer x = r.get(this);
    return Tup.make("Label",x==null ? _count : x);
  }
  @Override public SB str( SB sb ) { return sb.p("Label(").p(_count).p(')'); }
}
