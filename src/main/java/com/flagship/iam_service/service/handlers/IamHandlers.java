package com.flagship.iam_service.service.handlers;

import com.flagship.iam_service.domain.commands.AssignPermission;
import com.flagship.iam_service.domain.commands.CreateGroup;
import com.flagship.iam_service.domain.commands.CreateGroupRole;
import com.flagship.iam_service.domain.commands.CreateUser;
import com.flagship.iam_service.domain.commands.ExpirePermission;
import com.flagship.iam_service.domain.commands.MakePurchase;
import com.flagship.iam_service.domain.commands.RequestCreateGroup;
import com.flagship.iam_service.domain.iam.Group;
import com.flagship.iam_service.domain.iam.User;
import com.flagship.iam_service.service.unitofwork.UnitOfWork;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Command and event handlers of the IAM service.
 *
 * Each handler opens the shared unit of work, loads or creates one
 * aggregate, executes the command, stores the aggregate and commits.
 * Leaving the try block on an exception rolls the transaction back.
 */
@Component
@Slf4j
public class IamHandlers {

    /**
     * @return id of the new user
     */
    public UUID createUser(CreateUser command, UnitOfWork uow) {
        try (UnitOfWork work = uow.begin()) {
            User user = User.create(command);
            work.users().add(user);
            work.commit();
            log.info("Created user: id={}", user.getId());
            return user.getId();
        }
    }

    /**
     * Group purchases go to the group, all others to the user.
     *
     * @return version of the aggregate after the purchase
     */
    public int makePurchase(MakePurchase command, UnitOfWork uow) {
        try (UnitOfWork work = uow.begin()) {
            int version;
            if (command.groupPurchase()) {
                Group group = work.groups().get(command.aggregateId());
                group.execute(command);
                work.groups().add(group);
                version = group.getVersion();
            } else {
                User user = work.users().get(command.aggregateId());
                user.execute(command);
                work.users().add(user);
                version = user.getVersion();
            }
            work.commit();
            log.info("Purchase made: aggregateId={}, access={}, groupPurchase={}",
                    command.aggregateId(), command.requestedAccess(), command.groupPurchase());
            return version;
        }
    }

    /**
     * @return version of the user after the grant
     */
    public int assignPermission(AssignPermission command, UnitOfWork uow) {
        try (UnitOfWork work = uow.begin()) {
            User user = work.users().get(command.aggregateId());
            user.execute(command);
            work.users().add(user);
            work.commit();
            return user.getVersion();
        }
    }

    /**
     * @return version of the user after the expiry
     */
    public int expirePermission(ExpirePermission command, UnitOfWork uow) {
        try (UnitOfWork work = uow.begin()) {
            User user = work.users().get(command.userId());
            user.execute(command);
            work.users().add(user);
            work.commit();
            log.info("Expired permissions: userId={}, expired={}", command.userId(), command.expiredPermissions());
            return user.getVersion();
        }
    }

    /**
     * Records the request on the user. The group is created by
     * {@link #createGroup} once the internal event comes back through the bus.
     *
     * @return id reserved for the new group
     */
    public UUID requestCreateGroup(RequestCreateGroup command, UnitOfWork uow) {
        try (UnitOfWork work = uow.begin()) {
            User user = work.users().get(command.userId());
            UUID groupId = user.execute(command);
            work.users().add(user);
            work.commit();
            log.info("Group creation requested: userId={}, groupId={}", command.userId(), groupId);
            return groupId;
        }
    }

    /**
     * @return id of the created group
     */
    public UUID createGroup(User.CreateGroupRequested event, UnitOfWork uow) {
        try (UnitOfWork work = uow.begin()) {
            Group group = Group.create(new CreateGroup(event.name(), event.userId(), event.groupId()));
            work.groups().add(group);
            work.commit();
            log.info("Created group: id={}, createdBy={}", group.getId(), group.getCreatedBy());
            return group.getId();
        }
    }

    /**
     * @return version of the group after the role was added
     */
    public int createGroupRole(CreateGroupRole command, UnitOfWork uow) {
        try (UnitOfWork work = uow.begin()) {
            Group group = work.groups().get(command.groupId());
            group.execute(command);
            work.groups().add(group);
            work.commit();
            return group.getVersion();
        }
    }
}
