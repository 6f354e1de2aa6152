package dk.cloudcreate.bookstore.domain;

import dk.cloudcreate.bookstore.aggregates.command.*;
import dk.cloudcreate.bookstore.domain.author.*;
import dk.cloudcreate.bookstore.domain.book.*;
import dk.cloudcreate.bookstore.domain.category.*;
import dk.cloudcreate.bookstore.domain.publisher.*;
import dk.cloudcreate.bookstore.domain.tenant.TenantAggregate;

import java.util.*;

public final class BookStoreCommandHandlers {
    private BookStoreCommandHandlers() {
    }

    public static List<Class<? extends Command>> commandTypes() {
        var commandTypes = new ArrayList<Class<? extends Command>>();
        commandTypes.addAll(BookCommands.ALL);
        commandTypes.addAll(AuthorCommands.ALL);
        commandTypes.addAll(CategoryCommands.ALL);
        commandTypes.addAll(PublisherCommands.ALL);
        commandTypes.addAll(TenantAggregate.COMMANDS);
        return commandTypes;
    }

    /**
     * @throws IllegalStateException if a command type lacks a handler
     */
    public static CommandHandlerRegistry create() {
        var builder = CommandHandlerRegistry.builder();
        BookAggregate.registerHandlers(builder);
        AuthorAggregate.registerHandlers(builder);
        CategoryAggregate.registerHandlers(builder);
        PublisherAggregate.registerHandlers(builder);
        TenantAggregate.registerHandlers(builder);
        return builder.build(commandTypes());
    }
}
