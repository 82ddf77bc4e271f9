package com.example.librarypanels.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Transaction templates backing {@link com.example.librarypanels.transaction.TransactionScope}.
 *
 * <ul>
 *   <li><b>transactionTemplate</b> (primary): read/write unit of work</li>
 *   <li><b>readOnlyTransactionTemplate</b>: lookups that must see one consistent snapshot</li>
 *   <li><b>savepointTransactionTemplate</b>: nested unit of work inside an existing transaction</li>
 * </ul>
 */
@Configuration
public class TransactionConfig {

    @Bean
    @Primary
    public TransactionTemplate transactionTemplate(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }

    @Bean(name = "readOnlyTransactionTemplate")
    public TransactionTemplate readOnlyTransactionTemplate(PlatformTransactionManager transactionManager) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setReadOnly(true);
        return template;
    }

    @Bean(name = "savepointTransactionTemplate")
    public TransactionTemplate savepointTransactionTemplate(PlatformTransactionManager transactionManager) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
        return template;
    }
}
