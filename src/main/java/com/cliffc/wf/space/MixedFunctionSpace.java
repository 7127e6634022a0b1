package com.cliffc.wf.space;

import com.cliffc.wf.FormErr;
import com.cliffc.wf.sig.Renumbering;
import com.cliffc.wf.sig.Tup;
import com.cliffc.wf.util.Ary;

import java.util.Arrays;

// An ordered collection of FunctionSpaces, possibly over different domains
// and cells.
public class MixedFunctionSpace extends AbstractFunctionSpace {
  private final FunctionSpace[] _subs;
  private final Element[] _elements;

  public MixedFunctionSpace( AbstractFunctionSpace... args ) {
    super(Duality.of(args));
    _subs = new FunctionSpace[args.length];
    _elements = new Element[args.length];
    for( int i=0; i<args.length; i++ ) {
      if( !(args[i] instanceof FunctionSpace fs) )
        throw FormErr.construct("MixedFunctionSpace","Expecting FunctionSpace objects");
      _subs[i] = fs;
      _elements[i] = fs.ufl_element();
    }
  }

  @Override public AbstractFunctionSpace[] ufl_sub_spaces() { return _subs.clone(); }
  public FunctionSpace ufl_sub_space( int i ) { return _subs[i]; }
  public int num_sub_spaces() { return _subs.length; }

  public Element[] ufl_elements() { return _elements.clone(); }
  @Override public Element ufl_element() {
    Ary<Element> es = new Ary<>(Element.class);
    for( Element e : _elements ) if( es.find(e::equals) == -1 ) es.push(e);
    if( es._len == 1 ) return es.at(0);
    throw FormErr.query("Found multiple elements. Cannot return only one. "+
                        "Consider building a FunctionSpace from a mixed element in case of homogeneous dimension.");
  }

  @Override public Domain[] ufl_domains() {
    Ary<Domain> ds = new Ary<>(Domain.class);
    for( FunctionSpace s : _subs ) ds.addAll(s.ufl_domains());
    return Domains.join(Arrays.asList(ds.asAry()));
  }

  @Override public Tup hash_data() { return hash_data("MixedFunctionSpace",_subs); }
  @Override public Tup signature_data( Renumbering r ) { return signature_data("MixedFunctionSpace",_subs,r); }

  @Override public String toString() { return "MixedFunctionSpace(*"+Arrays.toString(_subs)+")"; }
}
