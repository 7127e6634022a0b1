package com.cliffc.wf.space;

import com.cliffc.wf.FormErr;
import com.cliffc.wf.sig.Renumbering;
import com.cliffc.wf.sig.Tup;
import com.cliffc.wf.util.SB;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;

// A single element over a domain.  The domain is absent, one Domain, or a
// tuple of Domains for an element on a mixed cell.
public class FunctionSpace extends AbstractFunctionSpace {
  private static final AbstractFunctionSpace[] NO_SUBS = new AbstractFunctionSpace[0];
  final Domain _domain;         // Single domain, or null
  final Domain[] _domains;      // Mixed (tuple) domain, or null
  final Element _element;

  public FunctionSpace( @NotNull Element element ) { this(null,null,element,Duality.PRIMAL); }
  public FunctionSpace( Domain domain, @NotNull Element element ) { this(domain,null,element,Duality.PRIMAL); }
  public FunctionSpace( @NotNull Domain[] domains, @NotNull Element element ) { this(null,domains.clone(),element,Duality.PRIMAL); }
  private FunctionSpace( Domain domain, Domain[] domains, Element element, Duality duality ) {
    super(duality);
    if( element==null ) throw FormErr.construct("FunctionSpace","Expecting an element");
    if( domains != null ) {
      // Deal with an element on a mixed cell
      Cell cell = element.cell();
      if( !cell.is_mixed() )
        throw FormErr.construct("Must have a mixed cell (tuple) if we have a mixed domain (tuple).");
      if( domains.length != cell.num_cells() )
        throw FormErr.construct("Mixed cell (tuple) and mixed domain (tuple) must have the same length.");
      for( int i=0; i<domains.length; i++ )
        check_domain(domains[i],cell.cell(i));
    } else if( domain != null )
      check_domain(domain,element.cell());
    _domain = domain;
    _domains = domains;
    _element = element;
  }
  private static void check_domain( Domain d, Cell c ) {
    if( d==null ) throw FormErr.construct("Expected non-abstract domain for initialization of function space.");
    if( !c.equals(d.ufl_cell()) )
      throw FormErr.construct("Non-matching cell of finite element and domain.");
  }

  // The same space, as a dual space
  public FunctionSpace dual() {
    return _duality==Duality.DUAL ? this : new FunctionSpace(_domain,_domains,_element,Duality.DUAL);
  }
  // The same space, as a primal space
  public FunctionSpace primal() {
    return _duality==Duality.PRIMAL ? this : new FunctionSpace(_domain,_domains,_element,Duality.PRIMAL);
  }

  @Override public AbstractFunctionSpace[] ufl_sub_spaces() { return NO_SUBS; }
  @Override public Element ufl_element() { return _element; }
  @Override public boolean mixed() { return _domains != null; }
  @Override public Domain[] ufl_domains() {
    if( _domains != null ) return _domains.clone();
    return _domain==null ? Domains.NONE : new Domain[]{_domain};
  }
  // Single domain as given; a tuple domain answers only if all its parts are one domain
  @Override public Domain ufl_domain() {
    return _domains==null ? _domain : Domains.single(Domains.join(Arrays.asList(_domains)));
  }

  private String tag() { return _duality==Duality.DUAL ? "DualSpace" : "FunctionSpace"; }

  @Override public Tup hash_data() {
    Object ddata;
    if( _domains != null ) {
      Object[] ds = new Object[_domains.length];
      for( int i=0; i<ds.length; i++ ) ds[i] = _domains[i].hash_data();
      ddata = Tup.make(ds);
    } else ddata = _domain==null ? null : _domain.hash_data();
    return Tup.make(tag(),ddata,_element.hash_data());
  }

  @Override public Tup signature_data( Renumbering r ) {
    Object ddata;
    if( _domains != null ) {
      Object[] ds = new Object[_domains.length];
      for( int i=0; i<ds.length; i++ ) ds[i] = _domains[i].signature_data(r);
      ddata = Tup.make(ds);
    } else ddata = _domain==null ? null : _domain.signature_data(r);
    return Tup.make(tag(),ddata,_element.hash_data());
  }

  @Override public String toString() {
    SB sb = new SB().p(tag()).p('(');
    if( _domains != null ) sb.p(Arrays.toString(_domains));
    else sb.pobj(_domain);
    return sb.p(", ").p(_element.toString()).p(')').toString();
  }
}
