package com.cliffc.wf.sig;

import com.cliffc.wf.util.SB;

import java.util.Arrays;

// Immutable, order-sensitive tuple with value equality; nulls allowed.
// The currency of signature and hash data: nested Tups, Strings, Integers.
public final class Tup {
  public static final Tup EMPTY = new Tup(new Object[0]);
  private final Object[] _es;
  private final int _hash;
  private Tup( Object[] es ) { _es = es; _hash = Arrays.deepHashCode(es); }

  public static Tup make( Object... es ) { return es.length==0 ? EMPTY : new Tup(es.clone()); }
  // Tag followed by the parts
  public static Tup make( String tag, Object[] parts ) {
    Object[] es = new Object[parts.length+1];
    es[0] = tag;
    System.arraycopy(parts,0,es,1,parts.length);
    return new Tup(es);
  }

  public int len() { return _es.length; }
  public Object at( int i ) { return _es[i]; }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof Tup t) || _hash != t._hash ) return false;
    return Arrays.deepEquals(_es,t._es);
  }
  @Override public int hashCode() { return _hash; }

  public SB str( SB sb ) {
    sb.p('(');
    for( Object o : _es ) {
      if( o instanceof Tup t ) t.str(sb);
      else if( o instanceof String s ) quote(sb,s);
      else sb.pobj(o);
      sb.p(", ");
    }
    if( _es.length==1 ) sb.unchar();   // ('x',)
    else if( _es.length>1 ) sb.unchar(2);
    return sb.p(')');
  }
  // Quote and backslash are escaped, so the printed form parses back uniquely
  private static void quote( SB sb, String s ) {
    sb.p('\'');
    for( int i=0; i<s.length(); i++ ) {
      char c = s.charAt(i);
      if( c=='\'' || c=='\\' ) sb.p('\\');
      sb.p(c);
    }
    sb.p('\'');
  }
  @Override public String toString() { return str(new SB()).toString(); }
}
