package io.github.yok.deploykit.service;

import io.github.yok.deploykit.credential.CredentialResolver;
import io.github.yok.deploykit.credential.DelegatingCredentialResolver;
import io.github.yok.deploykit.db.ConnectionBroker;
import io.github.yok.deploykit.db.ConnectionDescriptor;
import io.github.yok.deploykit.db.ConnectionFactory;
import io.github.yok.deploykit.db.JdbcConnectionFactory;
import io.github.yok.deploykit.db.Sleeper;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Creates the connection broker of a run.
 *
 * @author Yasuharu.Okawauchi
 */
@Component
public class BrokerFactory {

    private final ConnectionFactory connectionFactory;
    private final CredentialResolver credentialResolver;
    private final Sleeper sleeper;

    /**
     * Creates a factory that connects through JDBC and resolves {@code env:} and {@code file:}
     * references.
     */
    public BrokerFactory() {
        this(new JdbcConnectionFactory(), DelegatingCredentialResolver.defaults(), Sleeper.THREAD);
    }

    public BrokerFactory(ConnectionFactory connectionFactory,
            CredentialResolver credentialResolver, Sleeper sleeper) {
        this.connectionFactory = connectionFactory;
        this.credentialResolver = credentialResolver;
        this.sleeper = sleeper;
    }

    /**
     * Creates a broker holding the given descriptors.
     *
     * @param descriptors connection descriptors
     * @return new broker, to be closed by the caller
     */
    public ConnectionBroker create(List<ConnectionDescriptor> descriptors) {
        return new ConnectionBroker(descriptors, connectionFactory, credentialResolver, sleeper);
    }
}
