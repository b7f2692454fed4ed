package tech.syncbridge.platform.credential;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Removes retired credential versions once their grace window has passed.
 */
@ApplicationScoped
public class CredentialPurgeJob {

    @Inject
    CredentialStore credentialStore;

    @Scheduled(every = "${syncbridge.credentials.purge-interval:5m}", identity = "credential-purge",
        concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void purge() {
        credentialStore.purgeExpired();
    }
}
