package com.cliffc.wf.index;

import com.cliffc.wf.FormErr;
import com.cliffc.wf.util.Ary;
import com.cliffc.wf.util.SB;

import java.util.Arrays;

/** Free/repeated index extraction, Einstein convention.
 *
 *  Given a combined index context (the free indices of the operands followed
 *  by any new index symbols), every symbolic index is classified as either
 *  free (one occurrence) or repeated (exactly two occurrences, implicitly
 *  summed).  Fixed indices take no part.  Three or more occurrences of one
 *  symbol is an error.  Both lists keep first-appearance order.
 *
 *  Each occurrence carries the range it iterates over; the two occurrences of
 *  a repeated index must agree on it.
 */
public final class Indices {
  public static final Index[] NONE = new Index[0];
  public static final int[] NO_DIMS = new int[0];

  public final Index[] _free;     // Free indices, first-appearance order
  public final int[] _free_dims;  // Range of each free index
  public final Index[] _repeated; // Repeated (summed) indices
  public final int[] _rep_dims;   // Range of each repeated index
  private Indices( Index[] free, int[] fdims, Index[] rep, int[] rdims ) {
    _free = free; _free_dims = fdims; _repeated = rep; _rep_dims = rdims;
  }

  // Extraction without ranges; every range reported as -1.
  public static Indices extract( Idx[] ids ) {
    int[] dims = new int[ids.length];
    Arrays.fill(dims,-1);
    return extract(ids,dims);
  }

  public static Indices extract( Idx[] ids, int[] dims ) {
    assert ids.length==dims.length;
    Ary<Index> uniq = new Ary<>(Index.class);
    int[] cnts = new int[ids.length];
    int[] udims= new int[ids.length];
    for( int i=0; i<ids.length; i++ ) {
      if( !(ids[i] instanceof Index idx) ) continue; // Fixed
      int x = uniq.find(idx::equals);
      if( x == -1 ) {
        x = uniq._len;
        uniq.push(idx);
        udims[x] = dims[i];
      } else if( udims[x] != dims[i] )
        throw FormErr.construct(new SB().p("Repeated index ").p(idx.toString()).p(" has mismatched ranges ").p(udims[x]).p(" and ").p(dims[i]).toString());
      if( ++cnts[x] > 2 )
        throw FormErr.construct(new SB().p("Index ").p(idx.toString()).p(" appears more than twice").toString());
    }
    int nfree=0;
    for( int i=0; i<uniq._len; i++ ) if( cnts[i]==1 ) nfree++;
    Index[] free = new Index[nfree], rep = new Index[uniq._len-nfree];
    int[] fdims = new int[nfree], rdims = new int[uniq._len-nfree];
    for( int i=0, f=0, r=0; i<uniq._len; i++ )
      if( cnts[i]==1 ) { free[f]=uniq.at(i); fdims[f++]=udims[i]; }
      else             { rep [r]=uniq.at(i); rdims[r++]=udims[i]; }
    return new Indices(free,fdims,rep,rdims);
  }

  // Combined context of a free-index list and more index symbols, the
  // symbols all ranging over 'dim'.
  public static Indices extract( Index[] free, int[] fdims, Idx[] more, int dim ) {
    Idx[] ids = new Idx[free.length+more.length];
    int[] dims = new int[ids.length];
    System.arraycopy(free,0,ids,0,free.length);
    System.arraycopy(fdims,0,dims,0,free.length);
    for( int i=0; i<more.length; i++ ) { ids[free.length+i] = more[i]; dims[free.length+i] = dim; }
    return extract(ids,dims);
  }

  // True if the two index lists share a symbol
  public static boolean intersects( Index[] a, Index[] b ) {
    for( Index x : a )
      for( Index y : b )
        if( x.equals(y) )
          return true;
    return false;
  }
  // Same symbols, any order
  public static boolean same_set( Index[] a, Index[] b ) {
    if( a.length != b.length ) return false;
    outer:
    for( Index x : a ) {
      for( Index y : b ) if( x.equals(y) ) continue outer;
      return false;
    }
    return true;
  }
  // Position of the symbol in the list, or -1
  public static int find( Index[] ids, Idx i ) {
    for( int x=0; x<ids.length; x++ ) if( ids[x].equals(i) ) return x;
    return -1;
  }

  public static SB str( SB sb, Idx[] ids ) {
    sb.p('(');
    for( Idx i : ids ) i.str(sb).p(',');
    if( ids.length>1 ) sb.unchar();
    return sb.p(')');
  }
  @Override public String toString() {
    SB sb = str(new SB().p("free="),_free);
    return str(sb.p(" repeated="),_repeated).toString();
  }
}
