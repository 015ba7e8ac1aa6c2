package com.outbound.routing.support;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import com.outbound.routing.application.port.out.CommandPublisher;
import com.outbound.routing.domain.entity.RoutingCommand;
import com.outbound.routing.domain.valueobject.CommandType;

public class RecordingCommandPublisher implements CommandPublisher {

    private final List<RoutingCommand> published = new ArrayList<>();
    private volatile RuntimeException failure;
    private volatile Consumer<RoutingCommand> onPublish = command -> {
    };

    @Override
    public void publish(RoutingCommand command) {
        onPublish.accept(command);
        RuntimeException injected = failure;
        if (injected != null) {
            throw injected;
        }
        synchronized (this) {
            published.add(command);
        }
    }

    /** Every later publish throws {@code e}; pass null to recover. */
    public void failWith(RuntimeException e) {
        this.failure = e;
    }

    /** Hook run before each publish, e.g. to inspect store state at send time. */
    public void onPublish(Consumer<RoutingCommand> hook) {
        this.onPublish = hook;
    }

    public synchronized List<RoutingCommand> published() {
        return List.copyOf(published);
    }

    public synchronized List<CommandType> publishedTypes() {
        return published.stream().map(RoutingCommand::getType).collect(Collectors.toList());
    }

    public synchronized long count(CommandType type) {
        return published.stream().filter(c -> c.getType() == type).count();
    }
}
