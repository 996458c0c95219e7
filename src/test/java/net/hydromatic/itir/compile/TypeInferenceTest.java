/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.itir.compile;

import static net.hydromatic.itir.ast.IrBuilder.ir;
import static net.hydromatic.itir.compile.Fixtures.CARTESIAN;
import static net.hydromatic.itir.compile.Fixtures.I_DIM;
import static net.hydromatic.itir.compile.Fixtures.MESH;
import static net.hydromatic.itir.compile.Fixtures.VERTEX;
import static net.hydromatic.itir.compile.Fixtures.cartesianProgram;
import static net.hydromatic.itir.compile.Fixtures.fieldParam;
import static net.hydromatic.itir.compile.Fixtures.iDomain;
import static net.hydromatic.itir.compile.Fixtures.meshDomain;
import static net.hydromatic.itir.compile.Fixtures.sizeParam;
import static net.hydromatic.itir.compile.Fixtures.types;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.itir.ast.Ir;
import net.hydromatic.itir.ast.Pos;
import net.hydromatic.itir.type.DeferredType;
import net.hydromatic.itir.type.Dimension;
import net.hydromatic.itir.type.DimensionKind;
import net.hydromatic.itir.type.FieldType;
import net.hydromatic.itir.type.OffsetProvider;
import net.hydromatic.itir.type.ScalarType;
import net.hydromatic.itir.type.Type;
import org.junit.jupiter.api.Test;

/** Tests for {@link TypeInference}. */
public class TypeInferenceTest {
  private static Type typeOf(Ir.Expr expr) {
    final Ir.Expr typed =
        TypeInference.infer(expr, OffsetProvider.EMPTY, true);
    assertThat(typed, is(expr));
    return typed.type;
  }

  private static String errorOf(Ir.Node node, OffsetProvider offsetProvider) {
    final TypeInference.TypeException e =
        assertThrows(TypeInference.TypeException.class,
            () -> TypeInference.infer(node, offsetProvider, true));
    return e.getMessage();
  }

  @Test
  void testArithmetic() {
    assertThat(typeOf(ir.plus(ir.intLiteral(1), ir.intLiteral(2))),
        hasToString("int32"));
    assertThat(
        typeOf(
            ir.less(ir.floatLiteral(1.5), ir.ref("x", ScalarType.FLOAT64))),
        hasToString("bool"));
    assertThat(typeOf(ir.cast(ir.intLiteral(1), ScalarType.FLOAT32)),
        hasToString("float32"));
    assertThat(
        typeOf(
            ir.ifThenElse(ir.boolLiteral(true), ir.intLiteral(1),
                ir.intLiteral(2))),
        hasToString("int32"));
  }

  @Test
  void testTuples() {
    final Ir.Expr tuple =
        ir.makeTuple(ir.intLiteral(1), ir.boolLiteral(false));
    assertThat(typeOf(tuple), hasToString("tuple[int32, bool]"));
    assertThat(typeOf(ir.tupleGet(1, tuple)), hasToString("bool"));
  }

  @Test
  void testLet() {
    final Ir.Expr let =
        ir.let("a", ir.intLiteral(1),
            ir.multiplies(ir.ref("a"), ir.ref("a")));
    final Ir.FunCall typed =
        TypeInference.infer((Ir.FunCall) let, OffsetProvider.EMPTY, false);
    assertThat(typed.type, hasToString("int32"));
    final Ir.Lambda lambda = (Ir.Lambda) typed.fun;
    assertThat(lambda.type, hasToString("(int32) -> int32"));
    assertThat(lambda.params.get(0).type, hasToString("int32"));
  }

  /** Tests that a lambda applied to arguments of different types is
   * polymorphic: its own type is deferred, but each application has a
   * type. */
  @Test
  void testPolymorphicLambda() {
    final Ir.Lambda identity = ir.lambda("x", ir.ref("x"));
    final Ir.Expr let =
        ir.let("f", identity,
            ir.makeTuple(ir.call(ir.ref("f"), ir.intLiteral(1)),
                ir.call(ir.ref("f"), ir.boolLiteral(true))));
    final Ir.FunCall typed =
        TypeInference.infer((Ir.FunCall) let, OffsetProvider.EMPTY, false);
    assertThat(typed.type, hasToString("tuple[int32, bool]"));
    final Ir.Lambda typedIdentity = (Ir.Lambda) typed.arg(0);
    assertThat(typedIdentity.type, is(DeferredType.INSTANCE));
    assertThat(typedIdentity.params.get(0).type, is(DeferredType.INSTANCE));
  }

  @Test
  void testClosure() {
    final Ir.Program program =
        cartesianProgram(
            ir.lambda("x",
                ir.deref(ir.call(ir.shift("Ioff", 1), ir.ref("x")))));
    final Ir.Program typed = TypeInference.infer(program, CARTESIAN);
    assertThat(typed, is(program));
    assertThat(typed.type,
        hasToString("Program[(Field[[IDim], float64], "
            + "Field[[IDim], float64], int32), "
            + "[StencilClosure[Domain[[IDim]], "
            + "(It[[IDim], [IDim], float64]) -> float64, "
            + "Field[[IDim], float64], [Field[[IDim], float64]]]]]"));
    final Ir.StencilClosure closure = typed.closures().get(0);
    final Ir.Lambda stencil = (Ir.Lambda) closure.stencil;
    assertThat(stencil.params.get(0).type,
        hasToString("It[[IDim], [IDim], float64]"));
    assertThat(stencil.expr.type, hasToString("float64"));
    assertThat(closure.domain.type, hasToString("Domain[[IDim]]"));
  }

  @Test
  void testFieldOperator() {
    final Ir.FunCall domain = iDomain("n");
    final Ir.Program program =
        ir.program("p",
            ImmutableList.of(fieldParam("inp", I_DIM),
                fieldParam("out", I_DIM), sizeParam("n")),
            ir.setAt(
                ir.call(
                    ir.asFieldop(ir.lambda("x", ir.deref(ir.ref("x"))),
                        domain),
                    ir.ref("inp")),
                domain, ir.ref("out")));
    final Ir.Program typed = TypeInference.infer(program, CARTESIAN);
    final Ir.SetAt setAt = (Ir.SetAt) typed.body.get(0);
    assertThat(setAt.expr.type, hasToString("Field[[IDim], float64]"));
  }

  /** Tests that a shift along a connectivity must start from its origin
   * dimension, and that {@code neighbors} returns a list. */
  @Test
  void testUnstructured() {
    final Ir.Expr stencil =
        ir.lambda("x",
            ir.call(ir.reduce(ir.ref("plus"), ir.floatLiteral(0)),
                ir.neighbors("V2E", ir.ref("x"))));
    final Ir.Program program =
        ir.program("p",
            ImmutableList.of(fieldParam("inp", Fixtures.EDGE),
                fieldParam("out", VERTEX), sizeParam("n")),
            ir.closure(meshDomain(VERTEX, "n"),
                ir.lambda("x",
                    ir.deref(ir.call(ir.shift("E2V", 0), ir.ref("x")))),
                "out", "inp"));
    // "E2V" moves from Edge to Vertex, but the iterator is on Vertex
    assertThat(errorOf(program, MESH),
        is("cannot shift iterator positioned on [Vertex] along 'E2V'"));

    final Ir.Program program2 =
        ir.program("p",
            ImmutableList.of(fieldParam("inp", Fixtures.EDGE),
                fieldParam("out", VERTEX), sizeParam("n")),
            ir.closure(meshDomain(VERTEX, "n"), stencil, "out", "inp"));
    final Ir.Program typed = TypeInference.infer(program2, MESH);
    final Ir.Lambda typedStencil =
        (Ir.Lambda) typed.closures().get(0).stencil;
    final Ir.FunCall reduce = (Ir.FunCall) typedStencil.expr;
    assertThat(reduce.type, hasToString("float64"));
    assertThat(reduce.arg(0).type, hasToString("List[float64]"));
  }

  /** Tests that an input with a local dimension (a sparse field) becomes
   * an iterator over lists, which a stencil can reduce. */
  @Test
  void testSparseField() {
    final Dimension v2eDim = new Dimension("V2E", DimensionKind.LOCAL);
    final Ir.Sym sparse =
        ir.sym("inp",
            new FieldType(ImmutableList.of(VERTEX, v2eDim),
                ScalarType.FLOAT64));
    final Ir.Program program =
        ir.program("p",
            ImmutableList.of(sparse, fieldParam("out", VERTEX),
                sizeParam("n")),
            ir.closure(meshDomain(VERTEX, "n"),
                ir.lambda("x",
                    ir.call(ir.reduce(ir.ref("plus"), ir.floatLiteral(0)),
                        ir.deref(ir.ref("x")))),
                "out", "inp"));
    final Ir.Program typed = TypeInference.infer(program, MESH);
    final Ir.Lambda stencil = (Ir.Lambda) typed.closures().get(0).stencil;
    assertThat(stencil.params.get(0).type,
        hasToString("It[[Vertex], [Vertex], List[float64]]"));
    final Ir.FunCall reduce = (Ir.FunCall) stencil.expr;
    assertThat(reduce.arg(0).type, hasToString("List[float64]"));
    assertThat(reduce.type, hasToString("float64"));
  }

  /** Tests that a node whose existing type contradicts the inferred type is
   * an internal error, not a user error. */
  @Test
  void testContradictsExistingType() {
    final Ir.Expr expr =
        ir.let("x", ir.intLiteral(1), ir.ref("x", ScalarType.BOOL));
    final AssertionError e =
        assertThrows(AssertionError.class,
            () -> TypeInference.infer(expr, OffsetProvider.EMPTY, false));
    assertThat(e.getMessage(),
        is("type of x was bool, now incompatible type int32"));
  }

  @Test
  void testErrors() {
    assertThat(
        errorOf(ir.plus(ir.intLiteral(1), ir.boolLiteral(true)),
            OffsetProvider.EMPTY),
        is("operands of plus must have the same type, got int32 and bool"));
    assertThat(
        errorOf(
            ir.ifThenElse(ir.intLiteral(1), ir.intLiteral(1),
                ir.intLiteral(2)),
            OffsetProvider.EMPTY),
        is("condition of if_ must be bool, got int32"));
    assertThat(
        errorOf(
            ir.tupleGet(2, ir.makeTuple(ir.intLiteral(1), ir.intLiteral(2))),
            OffsetProvider.EMPTY),
        is("tuple index 2 out of range for tuple[int32, int32]"));
    assertThat(
        errorOf(ir.namedRange("KDim", ir.intLiteral(0), ir.intLiteral(1)),
            OffsetProvider.EMPTY),
        is("dimension 'KDim' not found"));
    assertThat(
        errorOf(ir.deref(ir.call(ir.shift("Koff", 1), ir.ref("it"))),
            CARTESIAN),
        is("offset 'Koff' not found"));
  }

  @Test
  void testUndeclaredSymbol() {
    final TypeInference.TypeException e =
        assertThrows(TypeInference.TypeException.class,
            () -> TypeInference.infer(ir.ref(Pos.of("f", 2, 3, 4), "zz"),
                OffsetProvider.EMPTY, false));
    assertThat(e.getMessage(), is("undeclared symbol 'zz'"));
    assertThat(e.pos(), is(Pos.of("f", 2, 3, 4)));
    assertThat(e.describeTo(new StringBuilder()),
        hasToString("f:2.3 Error: undeclared symbol 'zz'"));
  }

  /** Tests that inferring the types of a typed program changes nothing. */
  @Test
  void testIdempotent() {
    final Ir.Program program =
        cartesianProgram(
            ir.lambda("x",
                ir.let("a", ir.deref(ir.ref("x")),
                    ir.plus(ir.ref("a"),
                        ir.deref(ir.call(ir.shift("Ioff", -1),
                            ir.ref("x")))))));
    final Ir.Program typed = TypeInference.infer(program, CARTESIAN);
    final Ir.Program typed2 = TypeInference.infer(typed, CARTESIAN);
    assertThat(typed2, is(typed));
    assertThat(types(typed2), is(types(typed)));
    assertThat(typed2.type, is(typed.type));
  }

  @Test
  void testProgramParamsMustBeTyped() {
    final Ir.Program program =
        ir.program("p", ir.syms("inp", "out"),
            ir.closure(iDomain("inp"), ir.ref("deref"), "out", "inp"));
    final TypeInference.TypeException e =
        assertThrows(TypeInference.TypeException.class,
            () -> TypeInference.infer(program, CARTESIAN));
    assertThat(e.getMessage(),
        is("parameter 'inp' of program 'p' must have a data type"));
  }

  @Test
  void testResultIsCopy() {
    final Ir.Expr expr = ir.plus(ir.intLiteral(1), ir.intLiteral(2));
    final Ir.Expr typed = TypeInference.infer(expr, OffsetProvider.EMPTY,
        false);
    assertThat(expr.type == null, is(true));
    assertThat(typed.type, sameInstance(ScalarType.INT32));
  }
}

// End TypeInferenceTest.java
