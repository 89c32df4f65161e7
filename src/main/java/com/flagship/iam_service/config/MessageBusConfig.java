package com.flagship.iam_service.config;

import com.flagship.iam_service.domain.commands.AssignPermission;
import com.flagship.iam_service.domain.commands.CreateGroupRole;
import com.flagship.iam_service.domain.commands.CreateUser;
import com.flagship.iam_service.domain.commands.ExpirePermission;
import com.flagship.iam_service.domain.commands.MakePurchase;
import com.flagship.iam_service.domain.commands.RequestCreateGroup;
import com.flagship.iam_service.domain.iam.User;
import com.flagship.iam_service.eventsourcing.mapper.EventMapper;
import com.flagship.iam_service.eventsourcing.recorder.ApplicationRecorder;
import com.flagship.iam_service.observability.MessageBusMetrics;
import com.flagship.iam_service.outbox.OutboxStore;
import com.flagship.iam_service.service.handlers.IamHandlers;
import com.flagship.iam_service.service.messagebus.HandlerRegistry;
import com.flagship.iam_service.service.messagebus.MessageBus;
import com.flagship.iam_service.service.unitofwork.TransactionalUnitOfWork;
import com.flagship.iam_service.service.unitofwork.UnitOfWorkFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import static com.flagship.iam_service.service.messagebus.MessageHandler.withUnitOfWork;

/**
 * Message bus wiring: unit of work factory and handler tables.
 */
@Configuration
public class MessageBusConfig {

    @Bean
    public UnitOfWorkFactory unitOfWorkFactory(PlatformTransactionManager transactionManager,
                                               EventMapper eventMapper,
                                               ApplicationRecorder applicationRecorder,
                                               OutboxStore outboxStore) {
        return () -> new TransactionalUnitOfWork(transactionManager, eventMapper, applicationRecorder, outboxStore);
    }

    @Bean
    public HandlerRegistry handlerRegistry(IamHandlers handlers) {
        return HandlerRegistry.builder()
                .command(CreateUser.class, withUnitOfWork("createUser", handlers::createUser))
                .command(MakePurchase.class, withUnitOfWork("makePurchase", handlers::makePurchase))
                .command(AssignPermission.class, withUnitOfWork("assignPermission", handlers::assignPermission))
                .command(ExpirePermission.class, withUnitOfWork("expirePermission", handlers::expirePermission))
                .command(RequestCreateGroup.class, withUnitOfWork("requestCreateGroup", handlers::requestCreateGroup))
                .command(CreateGroupRole.class, withUnitOfWork("createGroupRole", handlers::createGroupRole))
                .event(User.CreateGroupRequested.class, withUnitOfWork("createGroup", handlers::createGroup))
                .build();
    }

    @Bean
    public MessageBus messageBus(UnitOfWorkFactory unitOfWorkFactory, HandlerRegistry handlerRegistry,
                                 MessageBusMetrics messageBusMetrics) {
        return new MessageBus(unitOfWorkFactory, handlerRegistry, messageBusMetrics);
    }
}
