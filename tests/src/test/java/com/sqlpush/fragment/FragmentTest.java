package com.sqlpush.fragment;

import com.sqlpush.test.TestBase;
import com.sqlpush.test.TestCategories;
import com.sqlpush.types.IntegerType;
import com.sqlpush.types.NullType;
import com.sqlpush.types.StringType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link Fragment} rendering and the {@link Sql} builders.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Fragment Tests")
public class FragmentTest extends TestBase {

    @Nested
    @DisplayName("Rendering")
    class Rendering {

        @Test
        @DisplayName("Raw text renders verbatim with no parameters")
        void testRawRendersVerbatim() {
            RenderedStatement stmt = Fragment.raw("NOW()").render();

            assertThat(stmt.sql()).isEqualTo("NOW()");
            assertThat(stmt.parameters()).isEmpty();
        }

        @Test
        @DisplayName("Bound value renders as a placeholder")
        void testBoundRendersPlaceholder() {
            RenderedStatement stmt = Fragment.bound("abc", StringType.get()).render();

            assertThat(stmt.sql()).isEqualTo("?");
            assertThat(stmt.parameters())
                .containsExactly(new BoundParameter("abc", StringType.get()));
            assertThat(stmt.placeholderCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Bound value without a type is typed NULL")
        void testBoundWithoutType() {
            Fragment.Bound bound = (Fragment.Bound) Fragment.bound(null, null);

            assertThat(bound.dataType()).isEqualTo(NullType.get());
        }

        @Test
        @DisplayName("Parameters follow placeholder order across nesting")
        void testParameterOrder() {
            Fragment fragment = Sql.func("F",
                Fragment.bound(1, IntegerType.get()),
                Sql.op("=", Fragment.bound(2, IntegerType.get()), Fragment.bound(3, IntegerType.get())));

            RenderedStatement stmt = fragment.render();
            logData("SQL", stmt.sql());

            assertThat(stmt.sql()).isEqualTo("F(?, (? = ?))");
            assertThat(stmt.parameters())
                .extracting(BoundParameter::value)
                .containsExactly(1, 2, 3);
        }

        @Test
        @DisplayName("Placeholder count matches the number of question marks")
        void testPlaceholderCountMatchesText() {
            Fragment fragment = Fragment.join(List.of(
                Fragment.bound("a", StringType.get()),
                Fragment.raw("1"),
                Fragment.bound("b", StringType.get())), ", ");

            RenderedStatement stmt = fragment.render();

            assertThat(stmt.sql()).isEqualTo("?, 1, ?");
            assertThat(stmt.sql().chars().filter(c -> c == '?').count())
                .isEqualTo(stmt.placeholderCount());
        }
    }

    @Nested
    @DisplayName("Identifiers")
    class Identifiers {

        @Test
        @DisplayName("Identifier is back-quoted")
        void testIdentifierQuoted() {
            assertThat(Fragment.identifier("amount").sql()).isEqualTo("`amount`");
        }

        @Test
        @DisplayName("Embedded backticks are doubled")
        void testIdentifierEscapesBackticks() {
            assertThat(Fragment.identifier("we`ird").sql()).isEqualTo("`we``ird`");
        }
    }

    @Nested
    @DisplayName("Builders")
    class Builders {

        @Test
        @DisplayName("concat joins two fragments with a separator")
        void testConcat() {
            Fragment fragment = Fragment.concat(Fragment.raw("a"), Fragment.bound("b", StringType.get()), ", ");

            assertThat(fragment.sql()).isEqualTo("a, ?");
        }

        @Test
        @DisplayName("parenthesize wraps in parentheses")
        void testParenthesize() {
            assertThat(Fragment.parenthesize(Fragment.raw("x")).sql()).isEqualTo("(x)");
        }

        @Test
        @DisplayName("func renders a call with comma-separated arguments")
        void testFunc() {
            assertThat(Sql.func("COALESCE", Fragment.raw("a"), Fragment.raw("0")).sql())
                .isEqualTo("COALESCE(a, 0)");
            assertThat(Sql.func("NOW").sql()).isEqualTo("NOW()");
        }

        @Test
        @DisplayName("op renders a parenthesized infix operation")
        void testOp() {
            assertThat(Sql.op("+", Fragment.raw("a"), Fragment.raw("b")).sql()).isEqualTo("(a + b)");
        }

        @Test
        @DisplayName("keywords mixes raw keywords and fragments")
        void testKeywords() {
            Fragment fragment = Sql.keywords("CASE", Fragment.raw("x"), "END");

            assertThat(fragment.sql()).isEqualTo("CASE x END");
        }

        @Test
        @DisplayName("keywords rejects other part types")
        void testKeywordsRejectsOtherTypes() {
            assertThatThrownBy(() -> Sql.keywords("CASE", 42))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("nullValue and number render fixed text")
        void testConstants() {
            assertThat(Sql.nullValue().sql()).isEqualTo("NULL");
            assertThat(Sql.number(-7).sql()).isEqualTo("-7");
        }
    }
}
