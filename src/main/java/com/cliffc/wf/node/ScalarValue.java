package com.cliffc.wf.node;

import com.cliffc.wf.sig.Renumbering;
import com.cliffc.wf.sig.Tup;
import com.cliffc.wf.util.SB;

// A literal scalar constant
public final class ScalarValue extends Terminal {
  public final double _value;
  public ScalarValue( double value ) {
    super(Op.ScalarValue);
    _value = value;
    _shape = SCALAR;
    init();
  }
  @Override int payload_hash() { return Double.hashCode(_value); }
  @Override boolean eq_payload( Node n ) { return Double.compare(_value,((ScalarValue)n)._value)==0; }
  @Override public Tup signature_data( Renumbering r, Tup[] ops ) { return Tup.make("ScalarValue",_value); }
  @Override public SB str( SB sb ) { return sb.p(_value); }
}
