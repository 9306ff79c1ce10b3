package com.purchasingpower.infragraph.service;

import com.purchasingpower.infragraph.configuration.TransactionProperties;
import com.purchasingpower.infragraph.configuration.VersioningProperties;
import com.purchasingpower.infragraph.exception.ConflictException;
import com.purchasingpower.infragraph.exception.ErrorKind;
import com.purchasingpower.infragraph.exception.GraphVersioningException;
import com.purchasingpower.infragraph.exception.StorePersistenceException;
import com.purchasingpower.infragraph.model.CallContext;
import com.purchasingpower.infragraph.model.ServiceType;
import com.purchasingpower.infragraph.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Runs tier work inside one store transaction and maps failures onto the
 * {@link GraphVersioningException} hierarchy.
 *
 * <p>Writes use the configured isolation (serializable by default). Calls made while
 * a transaction is already active join it, so a workflow composed of several
 * lifecycle operations commits or rolls back as a whole.
 */
@Slf4j
@Component
public class TierTransactions {

    private final TransactionTemplate writeTemplate;
    private final TransactionTemplate readTemplate;

    public TierTransactions(PlatformTransactionManager transactionManager, VersioningProperties properties) {
        TransactionProperties config = properties.getTransactions();

        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.writeTemplate.setIsolationLevel(config.getIsolation().value());
        this.writeTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);

        this.readTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate.setReadOnly(true);
        this.readTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);

        if (config.getTimeoutSeconds() > 0) {
            writeTemplate.setTimeout(config.getTimeoutSeconds());
            readTemplate.setTimeout(config.getTimeoutSeconds());
        }
        log.info("Tier transactions: isolation={}, timeout={}s", config.getIsolation(), config.getTimeoutSeconds());
    }

    public <T> T write(String operation, Supplier<T> work) {
        return execute(writeTemplate, operation, work);
    }

    public void writeVoid(String operation, Runnable work) {
        execute(writeTemplate, operation, () -> {
            work.run();
            return null;
        });
    }

    public <T> T read(String operation, Supplier<T> work) {
        return execute(readTemplate, operation, work);
    }

    private <T> T execute(TransactionTemplate template, String operation, Supplier<T> work) {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            // Joined: the outermost call logs and translates.
            return template.execute(status -> work.get());
        }

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.STORE, operation, log);
        ctx.begin(template.isReadOnly() ? "read-only" : "read-write");
        try {
            T result = template.execute(status -> work.get());
            ctx.completed("committed");
            return result;
        } catch (GraphVersioningException e) {
            ctx.rejected(e.getKind(), e.getMessage());
            throw e;
        } catch (ConcurrencyFailureException | DataIntegrityViolationException e) {
            ctx.rejected(ErrorKind.CONFLICT, e.getMostSpecificCause().getMessage());
            throw new ConflictException(operation + " lost a race with a concurrent transaction", e);
        } catch (DataAccessException | TransactionException e) {
            ctx.failed("store failure", e);
            throw new StorePersistenceException(operation + " failed in the backing store", e);
        }
    }
}
