package com.cbd.config;

import com.cbd.config.auth.OidcProviderConfig;
import com.cbd.config.rag.ModelConfig;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SystemConfigJsonTest {

    @Test
    void unmodeledFieldsSurviveSerialization() {
        String json = "{\"prefix\":\"cb\",\"llms\":{\"sagemaker\":[]},"
                + "\"rag\":{\"engines\":{\"kendra\":{\"enabled\":true,\"external\":[]}}}}";
        SystemConfig config = SystemConfigJson.fromJson(json);

        assertTrue(config.getAdditionalFields().containsKey("llms"));
        assertTrue(config.getRag().getEngines().getAdditionalFields().containsKey("kendra"));
        assertEquals(config, SystemConfigJson.fromJson(SystemConfigJson.toJson(config)));
    }

    @Test
    void absentFieldsStayAbsent() {
        SystemConfig config = SystemConfigJson.fromJson("{\"prefix\":\"cb\"}");
        assertNull(config.getEnableWaf());
        assertEquals("{\"prefix\":\"cb\"}", SystemConfigJson.toJson(config));
    }

    @Test
    void oidcUsesProviderWireNames() {
        SystemConfig config = SystemConfigJson.fromJson("{\"cognitoFederation\":{\"enabled\":true,"
                + "\"customOIDC\":{\"OIDCClient\":\"client\",\"OIDCSecret\":\"arn:aws:secretsmanager:us-east-1:123456789012:secret:oidc\","
                + "\"OIDCIssuerURL\":\"https://issuer.example.com\"}}}");
        OidcProviderConfig oidc = config.getCognitoFederation().getCustomOIDC();

        assertEquals("client", oidc.getClientId());
        assertEquals("https://issuer.example.com", oidc.getIssuerUrl());
        String json = SystemConfigJson.toJson(config);
        assertTrue(json.contains("\"OIDCClient\":\"client\""));
        assertFalse(json.contains("clientId"));
    }

    @Test
    void modelDefaultFlagUsesDefaultKey() {
        SystemConfig config = SystemConfigJson.fromJson(
                "{\"rag\":{\"crossEncoderModels\":[{\"provider\":\"sagemaker\",\"name\":\"m\",\"default\":true}]}}");
        ModelConfig model = config.getRag().getCrossEncoderModels().get(0);
        assertTrue(model.getDefaultModel());
        assertTrue(SystemConfigJson.toJson(config).contains("\"default\":true"));
    }

    @Test
    void treeIsIndependentOfConfig() {
        SystemConfig config = SystemConfigJson.fromJson("{\"prefix\":\"cb\",\"cfGeoRestrictList\":[\"DE\"]}");
        ObjectNode tree = SystemConfigJson.toTree(config);
        tree.put("prefix", "changed");
        tree.withArray("cfGeoRestrictList").add("FR");

        assertEquals("cb", config.getPrefix());
        assertEquals(1, config.getCfGeoRestrictList().size());
        assertEquals("changed", SystemConfigJson.fromTree(tree).getPrefix());
    }

    @Test
    void fromTreeRejectsWrongShape() {
        ObjectNode tree = SystemConfigJson.toTree(SystemConfigJson.fromJson("{}"));
        tree.put("vpc", "not-an-object");
        assertThrows(IllegalArgumentException.class, () -> SystemConfigJson.fromTree(tree));
    }

    @Test
    void malformedJsonIsUnchecked() {
        assertThrows(UncheckedIOException.class, () -> SystemConfigJson.fromJson("{\"prefix\":"));
    }

    @Test
    void defaultsResourceLoads() {
        SystemConfig defaults = SystemConfigDefaults.create();

        assertEquals("", defaults.getPrefix());
        assertEquals(7, defaults.getLogRetention());
        assertEquals(400, defaults.getRateLimitPerIP());
        assertEquals("us-east-1", defaults.getBedrock().getRegion());
        assertFalse(defaults.getBedrock().getGuardrails().getEnabled());
        assertEquals(4, defaults.getRag().getEmbeddingsModels().size());
        assertTrue(defaults.getAdditionalFields().containsKey("llms"));
        assertNotSame(defaults, SystemConfigDefaults.create());
        assertEquals(defaults, SystemConfigDefaults.create());
    }
}
