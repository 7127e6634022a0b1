package com.cliffc.wf.sig;

import com.cliffc.wf.FormErr;
import com.cliffc.wf.dag.Traversal;
import com.cliffc.wf.node.Coefficient;
import com.cliffc.wf.node.Label;
import com.cliffc.wf.node.Node;
import com.cliffc.wf.space.Domain;
import com.cliffc.wf.util.Counted;

import java.util.Arrays;
import java.util.HashMap;

/** Canonical numbers for counted entities.
 *
 *  Signature data never contains raw counts: each Coefficient, Label and
 *  Mesh is looked up here, so two expressions differing only in how their
 *  entities were numbered at creation get equal data.  Indices are numbered
 *  on first request, in the order signature data asks for them.
 */
public final class Renumbering {
  private final HashMap<Counted,Integer> _nums = new HashMap<>();
  private final HashMap<Counted,Integer> _idxs = new HashMap<>();

  public Renumbering put( Counted c, int n ) { _nums.put(c,n); return this; }
  public boolean has( Counted c ) { return _nums.containsKey(c); }
  public Integer get( Counted c ) { return _nums.get(c); }
  // Strict lookup
  public int at( Counted c ) {
    Integer n = _nums.get(c);
    if( n==null ) throw FormErr.query("No renumbering for "+c);
    return n;
  }
  // Next number in first-request order
  public int index( Counted i ) {
    Integer n = _idxs.get(i);
    if( n==null ) _idxs.put(i,n=_idxs.size());
    return n;
  }

  // Number coefficients (then their parents), labels and the domains of the
  // coefficient spaces, each kind from zero, in post-order first appearance.
  public static Renumbering of( Node... exprs ) {
    Renumbering r = new Renumbering();
    int[] cnts = new int[3];    // Coefficients, labels, domains
    for( Node n : Traversal.unique_post_order(Arrays.asList(exprs),x -> false) ) {
      if( n instanceof Coefficient c ) {
        for( Coefficient p=c; p!=null; p = p.parent() ) {
          if( !r.has(p) ) r.put(p,cnts[0]++);
          for( Domain d : p.ufl_domains() )
            if( d instanceof Counted cd && !r.has(cd) ) r.put(cd,cnts[2]++);
        }
      } else if( n instanceof Label l && !r.has(l) )
        r.put(l,cnts[1]++);
    }
    return r;
  }

  @Override public String toString() { return _nums.toString(); }
}
