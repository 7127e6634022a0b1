package com.cliffc.wf.util;

/** Tight/tiny StringBuilder wrapper.
 *  Short short names on purpose; so they don't obscure the printing. */
public final class SB {
  public final StringBuilder _sb;
  public SB(        ) { _sb = new StringBuilder( ); }
  public SB p( String s ) { _sb.append(s); return this; }
  public SB p( char   s ) { _sb.append(s); return this; }
  public SB p( int    s ) { _sb.append(s); return this; }
  public SB p( long   s ) { _sb.append(s); return this; }
  public SB p( double s ) { _sb.append(s); return this; }
  public SB p( boolean s) { _sb.append(s); return this; }
  // Not spelled "p" on purpose: too easy to accidentally say "p(1.0)" and
  // suddenly call the autoboxed version.
  public SB pobj( Object s ) { _sb.append(s==null ? "null" : s.toString()); return this; }
  // Print an int array as a shape tuple: "()", "(3,)", "(3,3)"
  public SB pshape( int[] shape ) {
    p('(');
    for( int i=0; i<shape.length; i++ ) {
      if( i>0 ) p(',');
      p(shape[i]);
    }
    return p(shape.length==1 ? ",)" : ")");
  }
  // Remove last char(s); used to trim trailing separators
  public SB unchar() { return unchar(1); }
  public SB unchar(int x) { _sb.setLength(_sb.length()-x); return this; }
  public int len() { return _sb.length(); }

  @Override public String toString() { return _sb.toString(); }
}
