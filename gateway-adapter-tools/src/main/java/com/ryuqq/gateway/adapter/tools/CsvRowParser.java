package com.ryuqq.gateway.adapter.tools;

import com.ryuqq.gateway.application.onboarding.OnboardingRow;
import com.ryuqq.gateway.application.onboarding.TabularDataException;
import com.ryuqq.gateway.application.onboarding.TabularRowParser;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Apache Commons CSV 기반 {@link TabularRowParser}.
 *
 * <p>첫 행은 헤더로 사용되며, 각 데이터 행은 헤더 이름을 키로 하는 {@link OnboardingRow}가 됩니다.</p>
 *
 * <ul>
 *   <li>빈 줄은 건너뜀</li>
 *   <li>값 앞뒤 공백은 무시</li>
 *   <li>헤더보다 짧은 행의 누락 칼럼은 빈 값으로 취급</li>
 * </ul>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public final class CsvRowParser implements TabularRowParser {

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .setIgnoreSurroundingSpaces(true)
        .setIgnoreEmptyLines(true)
        .setTrim(true)
        .build();

    @Override
    public List<OnboardingRow> parse(String data) {
        if (data == null || data.isBlank()) {
            throw new TabularDataException("CSV data is required");
        }

        try (CSVParser parser = CSVParser.parse(data, FORMAT)) {
            List<String> headers = parser.getHeaderNames();
            List<OnboardingRow> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                Map<String, String> columns = new LinkedHashMap<>();
                for (String header : headers) {
                    columns.put(header, record.isSet(header) ? record.get(header) : "");
                }
                rows.add(OnboardingRow.of(columns));
            }
            return rows;
        } catch (IOException | UncheckedIOException | IllegalStateException e) {
            throw new TabularDataException("Malformed CSV data: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new TabularDataException("Invalid CSV header: " + e.getMessage(), e);
        }
    }
}
