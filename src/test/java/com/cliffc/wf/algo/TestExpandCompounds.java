package com.cliffc.wf.algo;

import com.cliffc.wf.FormErr;
import com.cliffc.wf.Forms;
import com.cliffc.wf.node.*;
import com.cliffc.wf.space.Cell;
import com.cliffc.wf.space.FiniteElement;
import com.cliffc.wf.space.FunctionSpace;
import org.junit.Test;

import static com.cliffc.wf.algo.ExpandCompounds.expand_compounds;
import static org.junit.Assert.*;

public class TestExpandCompounds {
  private final Forms _forms = new Forms(3);
  private final Coefficient _s = _forms.coefficient(new FiniteElement("Lagrange",Cell.TETRAHEDRON,1));
  private final Coefficient _v = _forms.coefficient(FiniteElement.vector("Lagrange",Cell.TETRAHEDRON,1));
  private final Coefficient _t = _forms.coefficient(new FiniteElement("Lagrange",Cell.TETRAHEDRON,1,3,3));

  @Test public void testGradScalar() {
    Node x = expand_compounds(_forms,_forms.grad(_s));
    assertEquals(Op.ComponentTensor,x._op);
    assertArrayEquals(new int[]{3},x.shape());
    assertFalse(x.has_free());
    SpatialDerivative d = (SpatialDerivative)x.in(0);
    assertSame(_s,d.expression());
    assertEquals(3,d.dim());
  }

  @Test public void testGradVector() {
    Node x = expand_compounds(_forms,_forms.grad(_v));
    assertEquals(Op.ComponentTensor,x._op);
    assertArrayEquals(new int[]{3,3},x.shape());
    assertFalse(x.has_free());
    SpatialDerivative d = (SpatialDerivative)x.in(0);
    assertEquals(Op.Indexed,d.expression()._op);
    assertEquals(2,d.free_indices().length);
  }

  // The gradient axis follows the spatial dimension, not the value shape
  @Test public void testGradOtherDim() {
    Forms f2 = new Forms(2);
    Coefficient w = f2.coefficient(new FiniteElement("Lagrange",Cell.TRIANGLE,2,4));
    Node g = f2.grad(w);
    Node x = expand_compounds(f2,g);
    assertArrayEquals(new int[]{2,4},g.shape());
    assertArrayEquals(g.shape(),x.shape());
  }

  // div(v) == v[i].dx(i)
  @Test public void testDivVector() {
    Node x = expand_compounds(_forms,Forms.div(_v));
    assertEquals(Op.SpatialDerivative,x._op);
    assertEquals(0,x.rank());
    assertFalse(x.has_free());
    SpatialDerivative d = (SpatialDerivative)x;
    assertEquals(1,d.repeated_indices().length);
    assertEquals(3,(int)d.repeated_index_dimensions().get(d.repeated_indices()[0]));
    Indexed vi = (Indexed)d.expression();
    assertSame(_v,vi.in(0));
  }

  // The contracted axis runs over the context's spatial dimension
  @Test public void testDivSpatialDim() {
    Forms f2 = new Forms(2);
    Coefficient w2 = f2.coefficient(new FiniteElement("Lagrange",Cell.TRIANGLE,1,2));
    SpatialDerivative d = (SpatialDerivative)expand_compounds(f2,Forms.div(w2));
    assertEquals(2,d.dim());
    assertEquals(2,(int)d.repeated_index_dimensions().get(d.repeated_indices()[0]));
    Coefficient w3 = f2.coefficient(new FiniteElement("Lagrange",Cell.TRIANGLE,1,3));
    try {
      expand_compounds(f2,Forms.div(w3));
      fail();
    } catch( FormErr e ) {
      assertEquals(FormErr.Level.Construct,e._lvl);
      assertEquals("Div: Leading axis of length 3 does not match spatial dimension 2",e.getMessage());
    }
  }

  @Test public void testDivTensor() {
    Node x = expand_compounds(_forms,Forms.div(_t));
    assertEquals(Op.ComponentTensor,x._op);
    assertArrayEquals(new int[]{3},x.shape());
    assertFalse(x.has_free());
  }

  // Lowered operands feed the outer operator
  @Test public void testNested() {
    Node x = expand_compounds(_forms,Forms.div(_forms.grad(_s)));
    assertEquals(Op.SpatialDerivative,x._op);
    assertEquals(0,x.rank());
    Indexed gi = (Indexed)((SpatialDerivative)x).expression();
    assertEquals(Op.ComponentTensor,gi.in(0)._op);
    assertEquals(1,gi.repeated_indices().length+((SpatialDerivative)x).repeated_indices().length);
  }

  @Test public void testUntouched() {
    Node root = Forms.sum(_s,_forms.dx(_s,0));
    assertSame(root,expand_compounds(_forms,root));
  }

  @Test public void testCurlNotLowered() {
    try {
      expand_compounds(_forms,Forms.sum(Forms.rot(_v),Forms.scalar(1)));
      fail();
    } catch( FormErr e ) {
      assertEquals(FormErr.Level.Traverse,e._lvl);
      assertEquals("Rot has no basic-operator lowering",e.getMessage());
    }
    try {
      expand_compounds(_forms,_forms.curl(_v));
      fail();
    } catch( FormErr e ) {
      assertEquals(FormErr.Level.Traverse,e._lvl);
    }
  }
}
