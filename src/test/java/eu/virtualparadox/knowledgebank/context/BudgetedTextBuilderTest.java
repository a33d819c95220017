package eu.virtualparadox.knowledgebank.context;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BudgetedTextBuilderTest {

    @Test
    @DisplayName("Blocks are joined with the separator, which counts against the budget")
    void separatorCounts() {
        BudgetedTextBuilder builder = new BudgetedTextBuilder(10, "\n\n");

        assertThat(builder.tryAppend("abcd")).isTrue();
        assertThat(builder.separatorCost()).isEqualTo(2);
        assertThat(builder.tryAppend("efgh")).isTrue();
        assertThat(builder.build()).isEqualTo("abcd\n\nefgh");
        assertThat(builder.remaining()).isZero();
    }

    @Test
    @DisplayName("A block that does not fit is rejected whole")
    void atomic() {
        BudgetedTextBuilder builder = new BudgetedTextBuilder(10, "\n\n");
        builder.tryAppend("abcdef");

        assertThat(builder.tryAppend("gh")).isTrue();
        assertThat(builder.tryAppend("x")).isFalse();
        assertThat(builder.build()).isEqualTo("abcdef\n\ngh");
    }

    @Test
    @DisplayName("First block pays no separator")
    void firstBlock() {
        BudgetedTextBuilder builder = new BudgetedTextBuilder(5, "---");

        assertThat(builder.isEmpty()).isTrue();
        assertThat(builder.tryAppend("12345")).isTrue();
        assertThat(builder.length()).isEqualTo(5);
    }

    @Test
    @DisplayName("Negative budget accepts nothing")
    void negativeBudget() {
        BudgetedTextBuilder builder = new BudgetedTextBuilder(-3, "\n");

        assertThat(builder.tryAppend("")).isTrue();
        assertThat(builder.tryAppend("a")).isFalse();
        assertThat(builder.build()).isEmpty();
    }
}
