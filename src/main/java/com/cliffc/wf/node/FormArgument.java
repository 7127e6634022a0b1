package com.cliffc.wf.node;

import com.cliffc.wf.space.AbstractFunctionSpace;
import com.cliffc.wf.util.Counted;

// Terminals standing for a field in a form: the only legal payload of a
// ReferenceValue.
public interface FormArgument extends Counted {
  AbstractFunctionSpace ufl_function_space();
}
