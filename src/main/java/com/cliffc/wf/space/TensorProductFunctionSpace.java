package com.cliffc.wf.space;

import com.cliffc.wf.FormErr;
import com.cliffc.wf.sig.Renumbering;
import com.cliffc.wf.sig.Tup;
import com.cliffc.wf.util.Ary;

import java.util.Arrays;

// Ordered product of arbitrary spaces.  No cell matching between factors.
public class TensorProductFunctionSpace extends AbstractFunctionSpace {
  private final AbstractFunctionSpace[] _subs;
  public TensorProductFunctionSpace( AbstractFunctionSpace... subs ) {
    super(Duality.of(subs));
    for( AbstractFunctionSpace s : subs )
      if( s==null ) throw FormErr.construct("TensorProductFunctionSpace","Expecting function spaces");
    _subs = subs.clone();
  }

  @Override public AbstractFunctionSpace[] ufl_sub_spaces() { return _subs.clone(); }
  @Override public Element ufl_element() {
    throw FormErr.query("TensorProductFunctionSpace has no single element.");
  }
  @Override public Domain[] ufl_domains() {
    Ary<Domain> ds = new Ary<>(Domain.class);
    for( AbstractFunctionSpace s : _subs ) ds.addAll(s.ufl_domains());
    return Domains.join(Arrays.asList(ds.asAry()));
  }

  @Override public Tup hash_data() { return hash_data("TensorProductFunctionSpace",_subs); }
  @Override public Tup signature_data( Renumbering r ) { return signature_data("TensorProductFunctionSpace",_subs,r); }

  @Override public String toString() { return "TensorProductFunctionSpace(*"+Arrays.toString(_subs)+")"; }
}
