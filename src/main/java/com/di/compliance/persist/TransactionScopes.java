package com.di.compliance.persist;

import lombok.Getter;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Transaction templates for the PERSIST stage.
 *
 * <ul>
 *   <li>{@code document}: one transaction per document; a fatal error rolls back all of its inserts.</li>
 *   <li>{@code row}: nested savepoint per row, so a constraint violation discards only that row.</li>
 * </ul>
 */
@Getter
@Component
public class TransactionScopes {

    private final TransactionTemplate document;
    private final TransactionTemplate row;

    public TransactionScopes(PlatformTransactionManager transactionManager) {
        this.document = new TransactionTemplate(transactionManager);
        this.document.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        this.document.setName("persist-document");

        this.row = new TransactionTemplate(transactionManager);
        this.row.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
        this.row.setName("persist-row");
    }
}
