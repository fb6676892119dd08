package com.ecp.governance.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Getter
public class AerospikeConfig {

    public static final String SET_LEDGER_ENTRIES = "ledger_entries";
    public static final String SET_LEDGER_HEAD = "ledger_head";
    public static final String SET_DECISION_EVENTS = "decision_events";
    public static final String SET_CLASSIFICATIONS = "classifications";
    public static final String SET_CLASSIFICATION_ARCHIVE = "class_archive";
    public static final String SET_CONSENSUS = "consensus";
    public static final String SET_VIOLATIONS = "violations";
    public static final String SET_ESCALATIONS = "escalations";
    public static final String SET_RULINGS = "rulings";

    @Value("${aerospike.host:127.0.0.1}")
    private String host;

    @Value("${aerospike.port:3000}")
    private int port;

    @Value("${aerospike.namespace:ecp}")
    private String namespace;

    @Bean
    public AerospikeClient aerospikeClient() {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.maxConnsPerNode = 100;
        clientPolicy.timeout = 5000;

        clientPolicy.readPolicyDefault.totalTimeout = 3000;
        clientPolicy.readPolicyDefault.socketTimeout = 1000;

        clientPolicy.writePolicyDefault.totalTimeout = 3000;
        clientPolicy.writePolicyDefault.socketTimeout = 1000;

        return new AerospikeClient(clientPolicy, host, port);
    }

    /**
     * Overwriting write policy, used for records that are recomputed in place
     * (live classifications, consensus output, escalation status).
     */
    @Bean
    public WritePolicy defaultWritePolicy() {
        WritePolicy policy = new WritePolicy();
        policy.totalTimeout = 3000;
        policy.socketTimeout = 1000;
        return policy;
    }

    /**
     * Append-only write policy: the put fails with KEY_EXISTS_ERROR instead of
     * replacing an existing record. Ledger entries, event ids, archived
     * classifications, violations and rulings are written with this policy.
     */
    @Bean
    public WritePolicy createOnlyWritePolicy() {
        WritePolicy policy = new WritePolicy();
        policy.totalTimeout = 3000;
        policy.socketTimeout = 1000;
        policy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        return policy;
    }

    @Bean
    public Policy defaultReadPolicy() {
        Policy policy = new Policy();
        policy.totalTimeout = 3000;
        policy.socketTimeout = 1000;
        return policy;
    }

    @Bean
    public String aerospikeNamespace() {
        return namespace;
    }
}
