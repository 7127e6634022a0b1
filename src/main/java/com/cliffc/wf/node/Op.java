package com.cliffc.wf.node;

// Node kinds.  One tag per concrete Node class; rulesets dispatch on these.
public enum Op {
  // Terminals
  Coefficient      (true ),
  Label            (true ),
  ScalarValue      (true ),
  TransformOp      (true ),
  MultiIndex       (true ),
  // Compounds
  Variable         (false),
  ReferenceValue   (false),
  Transformed      (false),
  Sum              (false),
  Product          (false),
  Indexed          (false),
  ComponentTensor  (false),
  SpatialDerivative(false),
  Diff             (false),
  Grad             (false),
  Div              (false),
  Curl             (false),
  Rot              (false);

  public final boolean _terminal;
  Op( boolean terminal ) { _terminal = terminal; }
  public static final Op[] VALS = values();
}
