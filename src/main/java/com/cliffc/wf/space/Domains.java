package com.cliffc.wf.space;

import com.cliffc.wf.FormErr;
import com.cliffc.wf.util.Ary;

public abstract class Domains {
  public static final Domain[] NONE = new Domain[0];

  // Unique domains, first-appearance order.  All must agree on the
  // geometric dimension.
  public static Domain[] join( Iterable<Domain> domains ) {
    Ary<Domain> ds = new Ary<>(Domain.class);
    int gdim = -1;
    for( Domain d : domains ) {
      if( d==null ) continue;
      if( gdim == -1 ) gdim = d.geometric_dimension();
      else if( gdim != d.geometric_dimension() )
        throw FormErr.construct("Found domains with different geometric dimensions.");
      if( ds.find(d::equals) == -1 ) ds.push(d);
    }
    return ds.asAry();
  }

  // The single domain in the list, null if none, error if several.
  public static Domain single( Domain[] ds ) {
    if( ds.length==1 ) return ds[0];
    if( ds.length==0 ) return null;
    throw FormErr.query("Found multiple domains, cannot return just one.");
  }
}
