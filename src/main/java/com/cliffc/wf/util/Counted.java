package com.cliffc.wf.util;

// Entities with a counted identity: two of the same kind and count are the
// same logical entity.  Counts come from a Counter.
public interface Counted {
  int count();
}
