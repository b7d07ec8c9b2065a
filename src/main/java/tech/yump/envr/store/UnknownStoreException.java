package tech.yump.envr.store;

import java.util.Collection;

public class UnknownStoreException extends SecretStoreException {

    public UnknownStoreException(String name, Collection<String> available) {
        super("Unknown store '" + name + "'. Available stores: "
                + (available.isEmpty() ? "(none)" : String.join(", ", available)));
    }
}
