package com.ryuqq.gateway.adapter.tools;

import com.ryuqq.gateway.application.search.SearchResult;
import com.ryuqq.gateway.core.model.EntityRecord;
import com.ryuqq.gateway.core.model.SystemEvent;
import com.ryuqq.gateway.core.search.SearchCriterion;
import com.ryuqq.gateway.core.search.SearchOperator;

import java.time.Instant;
import java.util.List;

/**
 * 사용자/그룹/검색 결과의 텍스트 표현.
 *
 * <p>값이 없는 속성과 시각은 {@value #NOT_AVAILABLE}로 표시합니다. 시각은 ISO-8601(UTC)입니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
final class EntityTextRenderer {

    static final String NOT_AVAILABLE = "N/A";

    private EntityTextRenderer() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static String userDetails(EntityRecord user) {
        return "• User Details:\n"
            + "  ID: " + user.id() + "\n"
            + "  Status: " + user.status().name() + "\n"
            + "\n- Account Dates:\n"
            + line("Created", timestamp(user, EntityRecord.CREATED))
            + line("Activated", timestamp(user, EntityRecord.ACTIVATED))
            + line("Last Login", timestamp(user, EntityRecord.LAST_LOGIN))
            + line("Last Updated", timestamp(user, EntityRecord.LAST_UPDATED))
            + line("Status Changed", timestamp(user, EntityRecord.STATUS_CHANGED))
            + line("Password Changed", timestamp(user, EntityRecord.PASSWORD_CHANGED))
            + "\n- Personal Information:\n"
            + attributeLine(user, "Login", "login")
            + attributeLine(user, "Email", "email")
            + attributeLine(user, "Secondary Email", "secondEmail")
            + attributeLine(user, "First Name", "firstName")
            + attributeLine(user, "Last Name", "lastName")
            + attributeLine(user, "Display Name", "displayName")
            + attributeLine(user, "Nickname", "nickName")
            + "\n- Employment Details:\n"
            + attributeLine(user, "Organization", "organization")
            + attributeLine(user, "Title", "title")
            + attributeLine(user, "Division", "division")
            + attributeLine(user, "Department", "department")
            + attributeLine(user, "Employee Number", "employeeNumber")
            + attributeLine(user, "User Type", "userType")
            + attributeLine(user, "Cost Center", "costCenter")
            + "\n- Contact Information:\n"
            + attributeLine(user, "Mobile Phone", "mobilePhone")
            + attributeLine(user, "Primary Phone", "primaryPhone")
            + "\n- Address:\n"
            + attributeLine(user, "Street", "streetAddress")
            + attributeLine(user, "City", "city")
            + attributeLine(user, "State", "state")
            + attributeLine(user, "Zip Code", "zipCode")
            + attributeLine(user, "Country", "countryCode")
            + "\n- Preferences:\n"
            + attributeLine(user, "Preferred Language", "preferredLanguage")
            + "  Profile URL: " + user.attributeOr("profileUrl", NOT_AVAILABLE);
    }

    /**
     * 사용자 목록.
     *
     * @param heading 첫 줄 (예: "Users:")
     * @param users 사용자 목록 (비어있지 않음)
     * @param limit 요청한 limit (페이지 안내 여부 판단)
     * @param totalLabel 마지막 페이지일 때의 합계 라벨 (예: "Total users")
     * @return 텍스트
     */
    static String userList(String heading, List<EntityRecord> users, int limit, String totalLabel) {
        StringBuilder text = new StringBuilder(heading).append('\n');
        int index = 0;
        for (EntityRecord user : users) {
            index++;
            text.append('\n')
                .append(index).append(". ").append(displayName(user))
                .append(" (").append(user.attributeOr("email", "No email")).append(")\n")
                .append(" - ID: ").append(user.id()).append('\n')
                .append(" - Status: ").append(user.status().name()).append('\n')
                .append(" - Created: ").append(timestamp(user, EntityRecord.CREATED)).append('\n')
                .append(" - Last Updated: ").append(timestamp(user, EntityRecord.LAST_UPDATED)).append('\n');
        }
        appendPagination(text, users, limit, "Total users shown", totalLabel);
        return text.toString();
    }

    static String groupList(List<EntityRecord> groups, int limit) {
        StringBuilder text = new StringBuilder("Groups:\n");
        int index = 0;
        for (EntityRecord group : groups) {
            index++;
            text.append('\n')
                .append(index).append(". ").append(group.attributeOr("name", "Unnamed Group")).append('\n')
                .append("   - ID: ").append(group.id()).append('\n')
                .append("   - Type: ").append(group.attributeOr("type", "Unknown")).append('\n')
                .append("   - Object Class: ").append(group.attributeOr("objectClass", NOT_AVAILABLE)).append('\n')
                .append("   - Description: ").append(group.attributeOr("description", "No description")).append('\n')
                .append("   - Created: ").append(timestamp(group, EntityRecord.CREATED)).append('\n')
                .append("   - Last Updated: ").append(timestamp(group, EntityRecord.LAST_UPDATED)).append('\n')
                .append("   - Last Membership Updated: ")
                .append(timestamp(group, EntityRecord.LAST_MEMBERSHIP_UPDATED)).append('\n');
        }
        appendPagination(text, groups, limit, "Total groups shown", "Total groups");
        return text.toString();
    }

    static String groupDetails(EntityRecord group) {
        return "Group Details:\n"
            + "- ID: " + group.id() + "\n"
            + "- Name: " + group.attributeOr("name", NOT_AVAILABLE) + "\n"
            + "- Description: " + group.attributeOr("description", "No description") + "\n"
            + "- Type: " + group.attributeOr("type", "Unknown") + "\n"
            + "- Object Class: " + group.attributeOr("objectClass", NOT_AVAILABLE) + "\n"
            + "- Created: " + timestamp(group, EntityRecord.CREATED) + "\n"
            + "- Last Updated: " + timestamp(group, EntityRecord.LAST_UPDATED) + "\n"
            + "- Last Membership Updated: " + timestamp(group, EntityRecord.LAST_MEMBERSHIP_UPDATED);
    }

    static String lastLocation(String login, SystemEvent event) {
        return "• Last Login Information for User " + login + ":\n"
            + "  Time: " + event.published() + "\n"
            + "  Event Type: " + event.eventType() + "\n"
            + "  IP Address: " + orNotAvailable(event.ipAddress()) + "\n"
            + "  City: " + orNotAvailable(event.city()) + "\n"
            + "  State: " + orNotAvailable(event.state()) + "\n"
            + "  Country: " + orNotAvailable(event.country()) + "\n"
            + "  Device: " + orNotAvailable(event.device()) + "\n"
            + "  User Agent: " + orNotAvailable(event.userAgent());
    }

    /**
     * 검색 결과.
     *
     * <p>조건 값은 {@link SearchResult#echoedValue()}(PII 마스킹 적용)만 사용합니다.</p>
     *
     * @param result 검색 결과
     * @return 텍스트
     */
    static String searchResult(SearchResult result) {
        SearchCriterion criterion = result.criterion();
        String condition = criterion.attribute() + " " + criterion.operator().wireValue()
            + (criterion.operator() == SearchOperator.PRESENT ? "" : " \"" + result.echoedValue() + "\"");

        StringBuilder text = new StringBuilder();
        if (result.isEmpty()) {
            text.append("No users found where ").append(condition).append('.').append('\n');
        } else {
            text.append("Found ").append(result.matches().size()).append(" user(s) where ")
                .append(condition).append(":\n");
            int index = 0;
            for (EntityRecord user : result.matches()) {
                index++;
                text.append('\n')
                    .append(index).append(". ").append(displayName(user))
                    .append(" (").append(user.attributeOr("email", "No email")).append(")\n")
                    .append(" - ID: ").append(user.id()).append('\n')
                    .append(" - Status: ").append(user.status().name()).append('\n');
            }
        }

        text.append("\nSearch method: ").append(result.servedBy().label())
            .append(" (").append(result.candidatesExamined()).append(" candidate(s) examined)\n");
        for (String note : result.notes()) {
            text.append("- ").append(note).append('\n');
        }
        if (result.scanCapped()) {
            text.append("Warning: only the first ").append(result.scanCap())
                .append(" users in the directory were examined; matching users beyond them were not considered.\n");
        }
        return text.toString();
    }

    static String timestamp(EntityRecord record, String name) {
        return record.timestamp(name).map(Instant::toString).orElse(NOT_AVAILABLE);
    }

    private static String displayName(EntityRecord user) {
        return user.attributeOr("firstName", "") + " " + user.attributeOr("lastName", "");
    }

    private static void appendPagination(StringBuilder text, List<EntityRecord> records, int limit,
                                         String shownLabel, String totalLabel) {
        if (records.size() >= limit) {
            String after = records.get(records.size() - 1).id();
            text.append("\nPagination:\n- ").append(shownLabel).append(": ").append(records.size()).append('\n')
                .append("- For next page, use 'after' parameter with value: ").append(after).append('\n');
        } else {
            text.append('\n').append(totalLabel).append(": ").append(records.size()).append('\n');
        }
    }

    private static String line(String label, String value) {
        return "  " + label + ": " + value + "\n";
    }

    private static String attributeLine(EntityRecord record, String label, String attribute) {
        return line(label, record.attributeOr(attribute, NOT_AVAILABLE));
    }

    private static String orNotAvailable(String value) {
        return value == null || value.isBlank() ? NOT_AVAILABLE : value;
    }
}
