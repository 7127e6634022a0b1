package com.cliffc.wf.space;

import com.cliffc.wf.sig.Renumbering;
import com.cliffc.wf.sig.Tup;

// Geometric domain handle, opaque to everything but cell matching and
// fingerprinting.
public interface Domain {
  Cell ufl_cell();
  int geometric_dimension();
  // Renumbering-independent structural data
  Tup hash_data();
  // Structural data with the domain's own identity renumbered
  Tup signature_data( Renumbering r );
}
