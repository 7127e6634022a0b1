package com.cliffc.wf.util;

public class Util {
  // Concat two int arrays; used for shapes
  public static int[] cat( int[] a, int[] b ) {
    int[] c = new int[a.length+b.length];
    System.arraycopy(a,0,c,0,a.length);
    System.arraycopy(b,0,c,a.length,b.length);
    return c;
  }
  public static int[] cat( int a, int[] b ) { return cat(new int[]{a},b); }

  // Shallow array compare, using '==' instead of 'equals'.
  public static <E> boolean eq( E[] e0, E[] e1 ) {
    if( e0==e1 ) return true;
    if( e0==null || e1==null ) return false;
    if( e0.length != e1.length ) return false;
    for( int i=0; i<e0.length; i++ )
      if( e0[i] != e1[i] )
        return false;
    return true;
  }

  // Order-sensitive hash mixing, from the lookup3 final mix.
  // Result is never zero, so zero can mean "not computed".
  private static int rot(int x, int k) { return (x<<k) | (x>>>(32-k)); }
  public static int mix_hash( int a, int b ) { return mix_hash(a,b,0x9e3779b9); }
  public static int mix_hash( int a, int b, int c ) {
    c ^= b; c -= rot(b,14);
    a ^= c; a -= rot(c,11);
    b ^= a; b -= rot(a,25);
    c ^= b; c -= rot(b,16);
    a ^= c; a -= rot(c, 4);
    b ^= a; b -= rot(a,14);
    c ^= b; c -= rot(b,24);
    int hash = c;
    if( hash==0 ) hash=b;
    if( hash==0 ) hash=a;
    if( hash==0 ) hash=0xcafebabe;
    return hash;
  }
}
