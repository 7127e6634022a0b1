package com.cliffc.wf.space;

// Primal/dual capability tag carried by every function space.  A composite
// space is primal (dual) only if all of its sub-spaces are.
public enum Duality {
  PRIMAL,
  DUAL,
  NEITHER;

  static Duality of( AbstractFunctionSpace[] subs ) {
    boolean primal=true, dual=true;
    for( AbstractFunctionSpace s : subs ) {
      primal &= s._duality==PRIMAL;
      dual   &= s._duality==DUAL;
    }
    // Empty composites count as primal
    return primal ? PRIMAL : (dual ? DUAL : NEITHER);
  }

  public static boolean is_primal( Object o ) { return o instanceof AbstractFunctionSpace s && s._duality==PRIMAL; }
  public static boolean is_dual  ( Object o ) { return o instanceof AbstractFunctionSpace s && s._duality==DUAL  ; }
}
