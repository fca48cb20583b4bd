package com.sqlpush.exception;

import com.sqlpush.expression.ColumnReference;
import com.sqlpush.expression.Expression;
import com.sqlpush.test.TestBase;
import com.sqlpush.test.TestCategories;
import com.sqlpush.types.IntegerType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link TranslationException}.
 */
@TestCategories.Unit
@DisplayName("TranslationException Tests")
public class TranslationExceptionTest extends TestBase {

    private final Expression column = new ColumnReference(1, "x", IntegerType.get());

    @Test
    @DisplayName("withExpression attaches the failed expression once")
    void testWithExpression() {
        TranslationException original = new TranslationException("Illegal input for day of week: XX");

        TranslationException attached = original.withExpression(column);

        assertThat(attached.getFailedExpression()).isEqualTo(column);
        assertThat(attached.getMessage()).isEqualTo(original.getMessage());
        assertThat(attached.getCause()).isSameAs(original);
        assertThat(attached.withExpression(new ColumnReference(2, "y", IntegerType.get()))).isSameAs(attached);
    }

    @Test
    @DisplayName("User message explains the failure")
    void testUserMessage() {
        TranslationException e = new TranslationException("Illegal input for day of week: XX");

        assertThat(e.getUserMessage())
            .isEqualTo("Failed to translate expression for pushdown: Illegal input for day of week: XX. "
                       + "Please check the constant arguments of the query.");
    }

    @Test
    @DisplayName("Technical message names the failed expression")
    void testTechnicalMessage() {
        TranslationException e = new TranslationException("bad constant", column);

        String message = e.getTechnicalMessage();
        logData("Technical message", message);

        assertThat(message)
            .startsWith("Expression Translation Failed\nError: bad constant\n")
            .contains("Failed Expression Type: " + ColumnReference.class.getName());
    }
}
