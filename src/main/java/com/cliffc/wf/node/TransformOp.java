package com.cliffc.wf.node;

import com.cliffc.wf.sig.Renumbering;
import com.cliffc.wf.sig.Tup;
import com.cliffc.wf.util.SB;
import org.jetbrains.annotations.NotNull;

// The operator carried by a Transformed node, e.g. a filter.  Opaque to this
// kernel: only its name is known.
public final class TransformOp extends Terminal {
  public final String _name;
  public TransformOp( @NotNull String name ) {
    super(Op.TransformOp);
    _name = name;
    _shape = SCALAR;
    init();
  }
  @Override int payload_hash() { return _name.hashCode(); }
  @Override boolean eq_payload( Node n ) { return _name.equals(((TransformOp)n)._name); }
  @Override public Tup signature_data( Renumbering r, Tup[] ops ) { return Tup.make("TransformOp",_name); }
  @Override public SB str( SB sb ) { return sb.p(_name); }
}
