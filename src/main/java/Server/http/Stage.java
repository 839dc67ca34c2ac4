package Server.http;

/**
 * One step of the request pipeline. A stage decorates the next handler and
 * decides if, when and with which context it is invoked.
 */
@FunctionalInterface
public interface Stage {

    ContextualHandler wrap(ContextualHandler next);

    default String description() {
        return getClass().getSimpleName();
    }
}
