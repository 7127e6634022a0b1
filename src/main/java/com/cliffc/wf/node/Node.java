package com.cliffc.wf.node;

import com.cliffc.wf.index.Index;
import com.cliffc.wf.index.Indices;
import com.cliffc.wf.sig.Renumbering;
import com.cliffc.wf.sig.Signature;
import com.cliffc.wf.sig.Tup;
import com.cliffc.wf.util.SB;
import com.cliffc.wf.util.Util;

// Expression DAG node.
//
// Nodes are immutable once init() runs at the end of the concrete
// constructor.  Operands must exist before their parent, so the graph is
// acyclic by construction; sharing a node among many parents is normal.
// Rewrites build new nodes and never edit old ones.
//
// Every node has a shape (dimensions, possibly empty) and an ordered list of
// free indices, each with the range it iterates over.
public abstract class Node {
  public static final Node[] NO_OPS = new Node[0];
  static final int[] SCALAR = new int[0];

  public final Op _op;          // Kind tag; rulesets dispatch on it
  final Node[] _ops;            // Operands, fixed arity
  int[] _shape;                 // Set once in the constructor
  Index[] _free = Indices.NONE; // Free indices, set once in the constructor
  int[] _fdims = Indices.NO_DIMS;// Range of each free index
  private int _hash;            // Structural hash, set by init()

  Node( Op op, Node... ops ) {
    assert op._terminal == (ops.length==0);
    for( Node n : ops ) assert n!=null;
    _op = op;
    _ops = ops;
  }

  // Called last in every concrete constructor
  final <N extends Node> N init() {
    assert _shape != null;
    assert _free.length==_fdims.length;
    _hash = compute_hash();
    @SuppressWarnings("unchecked") N n = (N)this;
    return n;
  }

  public boolean is_terminal() { return _op._terminal; }
  public int len() { return _ops.length; }
  public Node in( int i ) { return _ops[i]; }
  public Node[] operands() { return _ops.clone(); }

  public int[] shape() { return _shape.clone(); }
  public int rank() { return _shape.length; }
  public Index[] free_indices() { return _free.clone(); }
  public int[] index_dims() { return _fdims.clone(); }
  public boolean has_free() { return _free.length>0; }

  // --------------------------------------------------------------------------
  // Rebuild this node kind with new operands and the same payload.
  public abstract Node reconstruct( Node[] ops );

  // Return this node if the operands are unchanged (by identity), else
  // rebuild.  Keeps sharing in rewrites that change nothing.
  public final Node reuse_if_untouched( Node[] ops ) {
    return Util.eq(ops,_ops) ? this : reconstruct(ops);
  }

  // --------------------------------------------------------------------------
  // Structural hash & equals.  Payload is whatever the kind carries besides
  // its operands.
  int payload_hash() { return 0; }
  boolean eq_payload( Node n ) { return true; }
  int compute_hash() {
    int h = Util.mix_hash(_op.ordinal()+1,payload_hash());
    for( Node n : _ops ) h = Util.mix_hash(h,n._hash);
    return h;
  }
  @Override public int hashCode() { return _hash; }
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof Node n) || _op!=n._op || _hash!=n._hash ) return false;
    if( !eq_payload(n) ) return false;
    for( int i=0; i<_ops.length; i++ )
      if( !_ops[i].equals(n._ops[i]) )
        return false;
    return true;
  }

  // --------------------------------------------------------------------------
  // Signature data: kind tag, payload, then the operands' data.  Operand
  // data is computed by the caller, once per shared operand.
  Object[] signature_payload( Renumbering r ) { return NO_PAYLOAD; }
  static final Object[] NO_PAYLOAD = new Object[0];
  public Tup signature_data( Renumbering r, Tup[] ops ) {
    Object[] pay = signature_payload(r);
    Object[] es = new Object[pay.length+ops.length];
    System.arraycopy(pay,0,es,0,pay.length);
    System.arraycopy(ops,0,es,pay.length,ops.length);
    return Tup.make(_op.name(),es);
  }
  // Whole sub-DAG signature data under a renumbering
  public final Tup signature_data( Renumbering r ) { return Signature.data(this,r); }

  // --------------------------------------------------------------------------
  // Everybody has to have a pretty print
  public abstract SB str( SB sb );
  @Override public final String toString() { return str(new SB()).toString(); }
  // Default print: label(op0, op1, ...)
  SB _str( SB sb, String label ) {
    sb.p(label).p('(');
    for( Node n : _ops ) n.str(sb).p(", ");
    if( _ops.length>0 ) sb.unchar(2);
    return sb.p(')');
  }
}
