package com.cliffc.wf.space;

import com.cliffc.wf.sig.Tup;

// Finite element handle
public interface Element {
  Cell cell();
  int[] value_shape();
  boolean is_cellwise_constant();
  Tup hash_data();
}
