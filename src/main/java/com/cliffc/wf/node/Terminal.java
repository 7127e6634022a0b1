package com.cliffc.wf.node;

import com.cliffc.wf.WF;

// Leaf of the DAG: no operands.
public abstract class Terminal extends Node {
  Terminal( Op op ) { super(op); }
  @Override public Node reconstruct( Node[] ops ) {
    throw WF.unimpl("Terminal "+_op+" has no operands to reconstruct with");
  }
}
