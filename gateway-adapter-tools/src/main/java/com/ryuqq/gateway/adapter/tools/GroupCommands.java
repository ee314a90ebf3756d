package com.ryuqq.gateway.adapter.tools;

import com.ryuqq.gateway.application.command.Command;
import com.ryuqq.gateway.application.command.CommandProvider;
import com.ryuqq.gateway.core.contract.InvocationResult;
import com.ryuqq.gateway.core.model.EntityDraft;
import com.ryuqq.gateway.core.model.EntityKind;
import com.ryuqq.gateway.core.model.EntityRecord;
import com.ryuqq.gateway.core.model.ListQuery;
import com.ryuqq.gateway.core.model.SortOrder;
import com.ryuqq.gateway.core.schema.FieldDescriptor;
import com.ryuqq.gateway.core.schema.FieldType;
import com.ryuqq.gateway.core.schema.InputShape;
import com.ryuqq.gateway.core.schema.ValidatedArguments;
import com.ryuqq.gateway.core.spi.DirectoryClient;
import com.ryuqq.gateway.core.spi.EntityNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 그룹 Command 모음.
 *
 * <p>get_group의 NotFound만 안내 결과로 반환하며, 나머지 실패는 Dispatcher가 오류 결과로 변환합니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public final class GroupCommands implements CommandProvider {

    private static final Logger log = LoggerFactory.getLogger(GroupCommands.class);

    private static final FieldDescriptor GROUP_ID = FieldDescriptor.requiredId("groupId", "ID of the group");
    private static final FieldDescriptor MEMBER_ID = FieldDescriptor.requiredId("userId", "ID of the user");

    private final DirectoryClient directory;

    /**
     * 생성자.
     *
     * @param directory 디렉터리 클라이언트
     * @throws IllegalArgumentException directory가 null인 경우
     */
    public GroupCommands(DirectoryClient directory) {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        this.directory = directory;
    }

    @Override
    public List<Command> commands() {
        return List.of(
            new Command("list_groups", "List groups with optional filtering and pagination",
                InputShape.of(
                    CommandFields.limit(),
                    FieldDescriptor.optional("filter", FieldType.STRING, "Filter expression for groups"),
                    FieldDescriptor.optional("search", FieldType.STRING, "Search expression across group fields"),
                    FieldDescriptor.optional("q", FieldType.STRING, "Simple text match on the group name"),
                    CommandFields.after(),
                    FieldDescriptor.optional("sortBy", FieldType.STRING, "Field to sort results by"),
                    CommandFields.sortOrder()
                ), this::listGroups),
            new Command("create_group", "Create a new group",
                InputShape.of(
                    FieldDescriptor.required("name", FieldType.STRING, "Name of the group").withMinLength(1),
                    FieldDescriptor.optional("description", FieldType.STRING, "Description of the group (optional)")
                ), this::createGroup),
            new Command("get_group", "Get detailed information about a specific group",
                InputShape.of(GROUP_ID), this::getGroup),
            new Command("delete_group", "Delete a group",
                InputShape.of(GROUP_ID), this::deleteGroup),
            new Command("assign_user_to_group", "Assign a user to a group",
                InputShape.of(GROUP_ID, MEMBER_ID), this::assignUserToGroup),
            new Command("remove_user_from_group", "Remove a user from a group",
                InputShape.of(GROUP_ID, MEMBER_ID), this::removeUserFromGroup),
            new Command("list_group_users", "List all users in a specific group",
                InputShape.of(GROUP_ID, CommandFields.limit(), CommandFields.after()), this::listGroupUsers)
        );
    }

    private InvocationResult listGroups(ValidatedArguments arguments) {
        int limit = arguments.integer("limit");
        ListQuery query = new ListQuery(
            limit,
            arguments.string("filter"),
            arguments.string("search"),
            arguments.string("q"),
            arguments.string("after"),
            arguments.string("sortBy"),
            SortOrder.fromValue(arguments.string("sortOrder"))
        );
        List<EntityRecord> groups = directory.list(EntityKind.GROUP, query);
        if (groups.isEmpty()) {
            return InvocationResult.text("No groups found matching your criteria.");
        }
        return InvocationResult.text(EntityTextRenderer.groupList(groups, limit));
    }

    private InvocationResult createGroup(ValidatedArguments arguments) {
        EntityRecord group = directory.create(EntityDraft.group(arguments.string("name"), arguments.string("description")));
        log.info("Created group {}", group.id());
        return InvocationResult.text("Group created successfully:\n"
            + "ID: " + group.id() + "\n"
            + "Name: " + group.attributeOr("name", arguments.string("name")) + "\n"
            + "Type: " + group.attributeOr("type", "OKTA_GROUP") + "\n"
            + "Created: " + EntityTextRenderer.timestamp(group, EntityRecord.CREATED));
    }

    private InvocationResult getGroup(ValidatedArguments arguments) {
        String groupId = arguments.string("groupId");
        try {
            return InvocationResult.text(EntityTextRenderer.groupDetails(directory.get(EntityKind.GROUP, groupId)));
        } catch (EntityNotFoundException e) {
            return InvocationResult.text("No group found with ID: " + groupId);
        }
    }

    private InvocationResult deleteGroup(ValidatedArguments arguments) {
        String groupId = arguments.string("groupId");
        directory.delete(EntityKind.GROUP, groupId);
        return InvocationResult.text("Group with ID " + groupId + " has been successfully deleted.");
    }

    private InvocationResult assignUserToGroup(ValidatedArguments arguments) {
        String groupId = arguments.string("groupId");
        String userId = arguments.string("userId");
        directory.assignToGroup(groupId, userId);
        return InvocationResult.text("User with ID " + userId
            + " has been successfully assigned to group with ID " + groupId + ".");
    }

    private InvocationResult removeUserFromGroup(ValidatedArguments arguments) {
        String groupId = arguments.string("groupId");
        String userId = arguments.string("userId");
        directory.removeFromGroup(groupId, userId);
        return InvocationResult.text("User with ID " + userId
            + " has been successfully removed from group with ID " + groupId + ".");
    }

    private InvocationResult listGroupUsers(ValidatedArguments arguments) {
        String groupId = arguments.string("groupId");
        int limit = arguments.integer("limit");
        ListQuery query = ListQuery.limit(limit).withAfter(arguments.string("after"));
        List<EntityRecord> members = directory.listGroupMembers(groupId, query);
        if (members.isEmpty()) {
            return InvocationResult.text("No users found in this group.");
        }
        return InvocationResult.text(EntityTextRenderer.userList(
            "Users in Group (ID: " + groupId + "):", members, limit, "Total users in group"));
    }
}
