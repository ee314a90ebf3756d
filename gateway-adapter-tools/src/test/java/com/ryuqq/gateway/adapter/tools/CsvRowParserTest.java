package com.ryuqq.gateway.adapter.tools;

import com.ryuqq.gateway.application.onboarding.OnboardingRow;
import com.ryuqq.gateway.application.onboarding.TabularDataException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CsvRowParser 테스트.
 *
 * @author Gateway Team
 * @since 1.0.0
 */
class CsvRowParserTest {

    private final CsvRowParser parser = new CsvRowParser();

    @Test
    void 헤더_이름을_키로_행을_만들고_빈_줄은_건너뛴다() {
        // given
        String csv = "email, firstName ,lastName,title\n"
            + "ada@corp.io, Ada ,Lovelace,\"Countess, Analyst\"\n"
            + "\n"
            + "alan@corp.io,Alan,Turing\n";

        // when
        List<OnboardingRow> rows = parser.parse(csv);

        // then
        assertThat(rows).hasSize(2);
        assertThat(rows.get(0).firstName()).isEqualTo("Ada");
        assertThat(rows.get(0).columns()).containsEntry("title", "Countess, Analyst");
        assertThat(rows.get(1).lastName()).isEqualTo("Turing");
        assertThat(rows.get(1).columns()).containsEntry("title", "");
    }

    @Test
    void 필수_칼럼이_비어도_행은_유지된다() {
        // when
        List<OnboardingRow> rows = parser.parse("email,firstName,lastName\n,Ada,Lovelace\n");

        // then
        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).missingRequired()).containsExactly("email");
    }

    @Test
    void 빈_입력은_거부한다() {
        assertThatThrownBy(() -> parser.parse("  "))
            .isInstanceOf(TabularDataException.class)
            .hasMessage("CSV data is required");
    }
}
