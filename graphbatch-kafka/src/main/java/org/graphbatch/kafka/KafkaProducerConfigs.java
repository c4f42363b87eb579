/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.graphbatch.kafka;

import org.graphbatch.annotation.Internal;
import org.graphbatch.config.ConfigOptions;
import org.graphbatch.config.Configuration;
import org.graphbatch.exception.IllegalConfigurationException;
import org.graphbatch.utils.PropertiesUtils;

import org.apache.commons.lang3.StringUtils;
import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.config.SaslConfigs;
import org.apache.kafka.common.config.SslConfigs;
import org.apache.kafka.common.serialization.StringSerializer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Translates a {@link Configuration} into the properties of the Kafka clients.
 *
 * <p>The security settings are validated: a SASL protocol needs the {@code PLAIN} mechanism with
 * a username and a password, or the {@code GSSAPI} mechanism with a Kerberos service name. TLS
 * material is only applied for the {@code SSL} and {@code SASL_SSL} protocols. Keys under {@link
 * ConfigOptions#KAFKA_PROPERTIES_PREFIX} are copied verbatim, after all other settings.
 */
@Internal
public final class KafkaProducerConfigs {

    static final String PLAINTEXT = "PLAINTEXT";
    static final String SSL = "SSL";
    static final String SASL_PLAINTEXT = "SASL_PLAINTEXT";
    static final String SASL_SSL = "SASL_SSL";

    static final String PLAIN = "PLAIN";
    static final String GSSAPI = "GSSAPI";

    private static final String PEM = "PEM";

    /** Properties of the batch producer. */
    public static Properties producerProperties(Configuration conf) {
        Map<String, Object> props = new HashMap<>(commonProperties(conf));
        int maxMessageSize = conf.get(ConfigOptions.KAFKA_MAX_MESSAGE_SIZE);
        int ackTimeoutMs = (int) conf.get(ConfigOptions.KAFKA_ACK_TIMEOUT).toMillis();
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.MAX_REQUEST_SIZE_CONFIG, maxMessageSize);
        props.put(ProducerConfig.BUFFER_MEMORY_CONFIG, (long) maxMessageSize);
        props.put(ProducerConfig.LINGER_MS_CONFIG, 0);
        props.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, ackTimeoutMs);
        props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, ackTimeoutMs);
        props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, (long) ackTimeoutMs);
        props.putAll(passThrough(conf));
        return PropertiesUtils.toProperties(props);
    }

    /** Properties of the admin client that manages the topic. */
    public static Properties adminProperties(Configuration conf) {
        Map<String, Object> props = new HashMap<>(commonProperties(conf));
        props.putAll(passThrough(conf));
        return PropertiesUtils.toProperties(props);
    }

    private static Map<String, Object> commonProperties(Configuration conf) {
        String bootstrapServers = conf.get(ConfigOptions.KAFKA_BOOTSTRAP_SERVERS);
        if (StringUtils.isBlank(bootstrapServers)) {
            throw new IllegalConfigurationException(
                    "'%s' must be set to stream batches.",
                    ConfigOptions.KAFKA_BOOTSTRAP_SERVERS.key());
        }
        Map<String, Object> props = new HashMap<>();
        props.put(CommonClientConfigs.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.putAll(securityProperties(conf));
        return props;
    }

    static Map<String, Object> securityProperties(Configuration conf) {
        String protocol = conf.get(ConfigOptions.KAFKA_SECURITY_PROTOCOL).toUpperCase();
        Map<String, Object> props = new HashMap<>();
        switch (protocol) {
            case PLAINTEXT:
                break;
            case SSL:
                props.putAll(sslProperties(conf));
                break;
            case SASL_PLAINTEXT:
                props.putAll(saslProperties(conf));
                break;
            case SASL_SSL:
                props.putAll(saslProperties(conf));
                props.putAll(sslProperties(conf));
                break;
            default:
                throw new IllegalConfigurationException(
                        "Unsupported security protocol '%s'.", protocol);
        }
        props.put(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG, protocol);
        return props;
    }

    private static Map<String, Object> saslProperties(Configuration conf) {
        String mechanism =
                conf.getOptional(ConfigOptions.KAFKA_SASL_MECHANISM)
                        .map(String::toUpperCase)
                        .orElse("");
        Map<String, Object> props = new HashMap<>();
        if (PLAIN.equals(mechanism)) {
            String username = conf.getOptional(ConfigOptions.KAFKA_SASL_USERNAME).orElse(null);
            String password = conf.getOptional(ConfigOptions.KAFKA_SASL_PASSWORD).orElse(null);
            if (StringUtils.isAnyEmpty(username, password)) {
                throw new IllegalConfigurationException(
                        "Please provide a username and a password for the PLAIN mechanism.");
            }
            props.put(
                    SaslConfigs.SASL_JAAS_CONFIG,
                    String.format(
                            "org.apache.kafka.common.security.plain.PlainLoginModule required "
                                    + "username=\"%s\" password=\"%s\";",
                            username, password));
        } else if (GSSAPI.equals(mechanism)) {
            String serviceName =
                    conf.getOptional(ConfigOptions.KAFKA_SASL_KERBEROS_SERVICE_NAME).orElse(null);
            if (StringUtils.isEmpty(serviceName)) {
                throw new IllegalConfigurationException(
                        "Please provide the Kerberos service name for the GSSAPI mechanism.");
            }
            props.put(SaslConfigs.SASL_KERBEROS_SERVICE_NAME, serviceName);
            String keytab = conf.getOptional(ConfigOptions.KAFKA_SASL_KERBEROS_KEYTAB).orElse(null);
            String principal =
                    conf.getOptional(ConfigOptions.KAFKA_SASL_KERBEROS_PRINCIPAL).orElse(null);
            if (StringUtils.isNoneEmpty(keytab, principal)) {
                props.put(
                        SaslConfigs.SASL_JAAS_CONFIG,
                        String.format(
                                "com.sun.security.auth.module.Krb5LoginModule required "
                                        + "useKeyTab=true storeKey=true keyTab=\"%s\" principal=\"%s\";",
                                keytab, principal));
            }
        } else {
            throw new IllegalConfigurationException(
                    "Unsupported SASL mechanism '%s', supported are PLAIN and GSSAPI.", mechanism);
        }
        props.put(SaslConfigs.SASL_MECHANISM, mechanism);
        return props;
    }

    private static Map<String, Object> sslProperties(Configuration conf) {
        Map<String, Object> props = new HashMap<>();
        conf.getOptional(ConfigOptions.KAFKA_SSL_CA_LOCATION)
                .ifPresent(
                        location -> {
                            props.put(SslConfigs.SSL_TRUSTSTORE_TYPE_CONFIG, PEM);
                            props.put(SslConfigs.SSL_TRUSTSTORE_LOCATION_CONFIG, location);
                        });
        String certificate =
                conf.getOptional(ConfigOptions.KAFKA_SSL_CERTIFICATE_LOCATION).orElse(null);
        String key = conf.getOptional(ConfigOptions.KAFKA_SSL_KEY_LOCATION).orElse(null);
        if (certificate != null || key != null) {
            if (certificate == null || key == null) {
                throw new IllegalConfigurationException(
                        "'%s' and '%s' have to be set together.",
                        ConfigOptions.KAFKA_SSL_CERTIFICATE_LOCATION.key(),
                        ConfigOptions.KAFKA_SSL_KEY_LOCATION.key());
            }
            props.put(SslConfigs.SSL_KEYSTORE_TYPE_CONFIG, PEM);
            props.put(SslConfigs.SSL_KEYSTORE_CERTIFICATE_CHAIN_CONFIG, readPem(certificate));
            props.put(SslConfigs.SSL_KEYSTORE_KEY_CONFIG, readPem(key));
            conf.getOptional(ConfigOptions.KAFKA_SSL_KEY_PASSWORD)
                    .ifPresent(password -> props.put(SslConfigs.SSL_KEY_PASSWORD_CONFIG, password));
        }
        props.put(
                SslConfigs.SSL_ENDPOINT_IDENTIFICATION_ALGORITHM_CONFIG,
                conf.get(ConfigOptions.KAFKA_SSL_CHECK_HOSTNAME) ? "https" : "");
        return props;
    }

    private static String readPem(String location) {
        try {
            return new String(Files.readAllBytes(Paths.get(location)), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalConfigurationException(
                    "Could not read PEM file '" + location + "'.", e);
        }
    }

    private static Map<String, String> passThrough(Configuration conf) {
        return PropertiesUtils.extractAndRemovePrefix(
                conf.toMap(), ConfigOptions.KAFKA_PROPERTIES_PREFIX);
    }

    private KafkaProducerConfigs() {}
}
