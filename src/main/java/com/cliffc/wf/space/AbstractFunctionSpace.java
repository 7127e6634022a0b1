package com.cliffc.wf.space;

import com.cliffc.wf.sig.Renumbering;
import com.cliffc.wf.sig.Tup;

// Where a field lives.  Equality and hashing are structural, from hash_data;
// sub-spaces are compared recursively, never by identity.
public abstract class AbstractFunctionSpace {
  final Duality _duality;
  private int _hash;            // Cached; spaces are immutable
  AbstractFunctionSpace( Duality duality ) { _duality = duality; }

  // Ordered sub-spaces; empty for a non-composite space
  public abstract AbstractFunctionSpace[] ufl_sub_spaces();
  // Flattened unique domains
  public abstract Domain[] ufl_domains();
  // The single domain, null if none; fails if there are several
  public Domain ufl_domain() { return Domains.single(ufl_domains()); }
  // The single element; fails if there is not exactly one
  public abstract Element ufl_element();
  // Defined on a mixed (tuple) domain
  public boolean mixed() { return false; }

  public Duality duality() { return _duality; }
  public boolean is_primal() { return _duality==Duality.PRIMAL; }
  public boolean is_dual  () { return _duality==Duality.DUAL  ; }

  public abstract Tup hash_data();
  public abstract Tup signature_data( Renumbering r );

  @Override public final boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof AbstractFunctionSpace s && getClass()==s.getClass() &&
      hashCode()==s.hashCode() && hash_data().equals(s.hash_data());
  }
  @Override public final int hashCode() {
    if( _hash==0 ) _hash = hash_data().hashCode() | 1;
    return _hash;
  }

  // Sub-space data, tagged
  static Tup hash_data( String tag, AbstractFunctionSpace[] subs ) {
    Object[] ds = new Object[subs.length];
    for( int i=0; i<ds.length; i++ ) ds[i] = subs[i].hash_data();
    return Tup.make(tag,ds);
  }
  static Tup signature_data( String tag, AbstractFunctionSpace[] subs, Renumbering r ) {
    Object[] ds = new Object[subs.length];
    for( int i=0; i<ds.length; i++ ) ds[i] = subs[i].signature_data(r);
    return Tup.make(tag,ds);
  }
}
