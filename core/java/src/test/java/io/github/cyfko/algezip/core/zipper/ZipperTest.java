package io.github.cyfko.algezip.core.zipper;

import io.github.cyfko.algezip.core.exception.NavigationException;
import io.github.cyfko.algezip.core.model.Constant;
import io.github.cyfko.algezip.core.model.Expression;
import io.github.cyfko.algezip.core.model.Operator;
import org.junit.jupiter.api.*;

import java.util.List;

import static io.github.cyfko.algezip.core.model.Expression.and;
import static io.github.cyfko.algezip.core.model.Expression.not;
import static io.github.cyfko.algezip.core.model.Expression.or;
import static io.github.cyfko.algezip.core.model.Expression.var;
import static io.github.cyfko.algezip.core.zipper.Direction.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link Zipper} over {@code ([a | b] & [!{a & b}])}, which has every operation
 * and three levels of nesting.
 */
@DisplayName("Zipper Tests")
public class ZipperTest {

    private static final Expression A = var('a');
    private static final Expression B = var('b');
    private static final Expression XOR = and(or(A, B), not(and(A, B)));

    private Zipper root;

    @BeforeEach
    void setUp() {
        root = Zipper.fromExpression(XOR);
    }

    // ========== Touch tests: down to a leaf and back ==========

    @Nested
    @DisplayName("Moving to a leaf")
    class TouchTests {

        @Test
        @DisplayName("Left a")
        void touchLeftA() {
            Zipper zipper = root.intoLeft().intoLeft();

            assertEquals(A, zipper.focus());
            assertEquals(List.of(
                    new LeftOperandContext(Operator.OR, B),
                    new LeftOperandContext(Operator.AND, not(and(A, B)))), zipper.path());
            assertEquals(XOR, zipper.wholeExpression());
            assertEquals(List.of(LEFT, LEFT), zipper.directionsFromRoot());
        }

        @Test
        @DisplayName("Left b")
        void touchLeftB() {
            Zipper zipper = root.intoLeft().intoRight();

            assertEquals(B, zipper.focus());
            assertEquals(List.of(
                    new RightOperandContext(Operator.OR, A),
                    new LeftOperandContext(Operator.AND, not(and(A, B)))), zipper.path());
            assertEquals(XOR, zipper.wholeExpression());
            assertEquals(List.of(LEFT, RIGHT), zipper.directionsFromRoot());
        }

        @Test
        @DisplayName("Right a")
        void touchRightA() {
            Zipper zipper = root.intoRight().intoNot().intoLeft();

            assertEquals(A, zipper.focus());
            assertEquals(List.of(
                    new LeftOperandContext(Operator.AND, B),
                    new NegationContext(),
                    new RightOperandContext(Operator.AND, or(A, B))), zipper.path());
            assertEquals(XOR, zipper.wholeExpression());
            assertEquals(List.of(RIGHT, ARG, LEFT), zipper.directionsFromRoot());
        }

        @Test
        @DisplayName("Right b")
        void touchRightB() {
            Zipper zipper = root.intoRight().intoNot().intoRight();

            assertEquals(B, zipper.focus());
            assertEquals(3, zipper.depth());
            assertEquals(XOR, zipper.wholeExpression());
            assertEquals(List.of(RIGHT, ARG, RIGHT), zipper.directionsFromRoot());
        }
    }

    @Test
    @DisplayName("Walking the whole tree returns to the starting zipper")
    void treeWalk() {
        Zipper end = root
                .intoLeft().intoLeft().up()
                .intoRight().up().up()
                .intoRight().intoNot().intoLeft().up()
                .intoRight().up().up().up();

        assertEquals(root, end);
        assertTrue(end.isAtRoot());
        assertEquals(XOR, end.focus());
    }

    @Test
    @DisplayName("up re-wraps the focus in its parent")
    void upRewrapsFocus() {
        Zipper zipper = root.intoRight().intoNot();

        assertEquals(and(A, B), zipper.focus());
        assertEquals(not(and(A, B)), zipper.up().focus());
    }

    @Test
    @DisplayName("top returns to the root from any depth")
    void topReturnsToRoot() {
        assertEquals(root, root.intoRight().intoNot().intoRight().top());
        assertEquals(root, root.top());
    }

    // ========== Navigation failures ==========

    @Nested
    @DisplayName("Navigation failures")
    class NavigationFailures {

        @Test
        @DisplayName("Cannot move up from the root")
        void cannotMoveUpFromRoot() {
            NavigationException ex = assertThrows(NavigationException.class, () -> root.up());
            assertEquals(NavigationException.Reason.AT_ROOT, ex.getReason());
            assertEquals("cannot move to parent -- already at the top", ex.getMessage());
        }

        @Test
        @DisplayName("Cannot move into the argument of a binary operation")
        void cannotMoveIntoArgumentOfBinary() {
            NavigationException ex = assertThrows(NavigationException.class, () -> root.intoNot());
            assertEquals(NavigationException.Reason.NOT_A_NEGATION, ex.getReason());
            assertEquals("cannot move to only argument -- not at a unary operation", ex.getMessage());
        }

        @Test
        @DisplayName("Cannot move left or right of a negation")
        void cannotMoveSidewaysOfNegation() {
            Zipper negation = root.intoRight();

            NavigationException left = assertThrows(NavigationException.class, negation::intoLeft);
            assertEquals(NavigationException.Reason.NOT_A_BINARY_OPERATION, left.getReason());
            assertEquals("cannot move to left argument -- not at a binary operation", left.getMessage());

            NavigationException right = assertThrows(NavigationException.class, negation::intoRight);
            assertEquals("cannot move to right argument -- not at a binary operation", right.getMessage());
        }

        @Test
        @DisplayName("Cannot move below a leaf")
        void cannotMoveBelowLeaf() {
            Zipper leaf = root.intoLeft().intoLeft();

            assertThrows(NavigationException.class, leaf::intoNot);
            assertThrows(NavigationException.class, leaf::intoLeft);
            assertThrows(NavigationException.class, leaf::intoRight);
        }

        @Test
        @DisplayName("A failed move leaves the zipper untouched")
        void failedMoveLeavesZipperUntouched() {
            Zipper zipper = root.intoLeft();
            Zipper before = Zipper.at(XOR, List.of(LEFT));

            assertThrows(NavigationException.class, zipper::intoNot);
            assertEquals(before, zipper);
        }
    }

    // ========== Replacement ==========

    @Test
    @DisplayName("replaceFocus keeps the path")
    void replaceFocusKeepsPath() {
        Zipper zipper = root.intoLeft().intoRight().replaceFocus(Constant.TRUE);

        assertEquals(Constant.TRUE, zipper.focus());
        assertEquals(List.of(LEFT, RIGHT), zipper.directionsFromRoot());
        assertEquals(and(or(A, Constant.TRUE), not(and(A, B))), zipper.wholeExpression());
    }

    @Test
    @DisplayName("replaceFocus at the root replaces the whole expression")
    void replaceAtRoot() {
        Zipper zipper = root.replaceFocus(Constant.FALSE);

        assertTrue(zipper.isAtRoot());
        assertEquals(Constant.FALSE, zipper.wholeExpression());
    }

    @Test
    @DisplayName("transform applies a function to the focus")
    void transformAppliesFunction() {
        Zipper zipper = root.intoRight().transform(Expression::not);

        assertEquals(not(not(and(A, B))), zipper.focus());
        assertEquals(and(or(A, B), not(not(and(A, B)))), zipper.wholeExpression());
    }

    @Test
    @DisplayName("Should reject a null replacement")
    void shouldRejectNullReplacement() {
        assertThrows(NullPointerException.class, () -> root.replaceFocus(null));
    }

    // ========== Directions ==========

    @Test
    @DisplayName("at re-creates a zipper from a direction list")
    void atRecreatesZipper() {
        Zipper navigated = root.intoRight().intoNot().intoLeft();
        Zipper recreated = Zipper.at(XOR, navigated.directionsFromRoot());

        assertEquals(navigated, recreated);
        assertEquals(navigated.hashCode(), recreated.hashCode());
    }

    @Test
    @DisplayName("into follows a single direction")
    void intoFollowsDirection() {
        assertEquals(root.intoLeft(), root.into(LEFT));
        assertEquals(root.intoRight(), root.into(RIGHT));
        assertEquals(root.intoRight().intoNot(), root.intoRight().into(ARG));
    }

    @Test
    @DisplayName("Contexts plug a child back and report their direction")
    void contextsPlugChildren() {
        assertEquals(not(A), new NegationContext().plug(A));
        assertEquals(and(A, B), new LeftOperandContext(Operator.AND, B).plug(A));
        assertEquals(or(A, B), new RightOperandContext(Operator.OR, A).plug(B));
        assertEquals(ARG, new NegationContext().direction());
        assertEquals(LEFT, new LeftOperandContext(Operator.AND, B).direction());
        assertEquals(RIGHT, new RightOperandContext(Operator.OR, A).direction());
    }

    @Test
    @DisplayName("Directions carry their command symbols")
    void directionSymbols() {
        assertEquals('.', ARG.symbol());
        assertEquals('<', LEFT.symbol());
        assertEquals('>', RIGHT.symbol());
    }
}
