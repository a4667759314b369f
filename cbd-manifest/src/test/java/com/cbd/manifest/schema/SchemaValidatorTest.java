package com.cbd.manifest.schema;

import com.cbd.manifest.DeploymentManifest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.junit.jupiter.api.Test;

import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchemaValidatorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SchemaValidator validator = SchemaValidator.forManifests();

    private ValidationResult validate(String json) throws Exception {
        return validator.validate(MAPPER.readTree(json));
    }

    private DeploymentManifest assertPasses(String json) throws Exception {
        ValidationResult result = validate(json);
        assertTrue(result.isValid(), () -> "expected valid, got:\n" + result.formatErrors());
        assertTrue(result.getErrors().isEmpty());
        return result.getManifest().orElseThrow();
    }

    private List<FieldError> assertFails(String json) throws Exception {
        ValidationResult result = validate(json);
        assertFalse(result.isValid());
        assertTrue(result.getManifest().isEmpty());
        assertFalse(result.getErrors().isEmpty());
        return result.getErrors();
    }

    private static List<String> paths(List<FieldError> errors) {
        return errors.stream().map(FieldError::path).collect(Collectors.toList());
    }

    @Test
    void requiresPrefix() throws Exception {
        List<FieldError> errors = assertFails("{}");
        assertEquals(List.of(new FieldError("prefix", "Required")), errors);
    }

    @Test
    void acceptsMinimalManifest() throws Exception {
        DeploymentManifest manifest = assertPasses("{\"prefix\": \"prod-cb\"}");
        assertEquals("prod-cb", manifest.getPrefix());
        assertFalse(manifest.has("enableWaf"));
    }

    @Test
    void rejectsPrefixStartingWithDigit() throws Exception {
        List<FieldError> errors = assertFails("{\"prefix\": \"1app\"}");
        assertEquals("prefix: Prefix must start with a letter and contain only letters, numbers, and hyphens",
                errors.get(0).format());
    }

    @Test
    void rejectsPrefixLongerThanSixteen() throws Exception {
        List<FieldError> errors = assertFails("{\"prefix\": \"abcdefghijklmnopq\"}");
        assertEquals(List.of(new FieldError("prefix", "Prefix must be at most 16 characters")), errors);
    }

    @Test
    void rejectsPrefixWithUnderscore() throws Exception {
        assertEquals(List.of("prefix"), paths(assertFails("{\"prefix\": \"my_app\"}")));
    }

    @Test
    void reportsEveryFailingCheckOnOneValue() throws Exception {
        List<FieldError> errors = assertFails("{\"prefix\": \"\"}");
        assertEquals(2, errors.size());
        assertEquals("Prefix is required", errors.get(0).message());
        assertEquals("prefix", errors.get(1).path());
    }

    @Test
    void acceptsVpcConfiguration() throws Exception {
        assertPasses("""
                {
                  "prefix": "test-app",
                  "vpc": {
                    "vpcId": "vpc-0123456789abcdef0",
                    "subnetIds": ["subnet-0123456789abcdef0", "subnet-0123456789abcdef1"]
                  }
                }
                """);
    }

    @Test
    void rejectsInvalidVpcId() throws Exception {
        List<FieldError> errors = assertFails("{\"prefix\": \"test-app\", \"vpc\": {\"vpcId\": \"invalid-vpc\"}}");
        assertEquals("vpc.vpcId", errors.get(0).path());
    }

    @Test
    void reportsArrayElementByIndex() throws Exception {
        List<FieldError> errors = assertFails("""
                {"prefix": "test-app", "vpc": {"subnetIds": ["subnet-0123456789abcdef0", "subnet-xyz"]}}
                """);
        assertEquals(List.of(new FieldError("vpc.subnetIds.1", "Invalid subnet ID format. Expected: subnet-xxxxxxxx")),
                errors);
    }

    @Test
    void rejectsEmptySubnetList() throws Exception {
        List<FieldError> errors = assertFails("{\"prefix\": \"test-app\", \"vpc\": {\"subnetIds\": []}}");
        assertEquals("vpc.subnetIds", errors.get(0).path());
    }

    @Test
    void endpointIpsRequireEndpointId() throws Exception {
        List<FieldError> errors = assertFails("""
                {"prefix": "test-app", "vpc": {"s3VpcEndpointIps": ["10.0.1.5"]}}
                """);
        assertEquals(List.of(new FieldError("vpc.s3VpcEndpointId",
                "s3VpcEndpointId is required when s3VpcEndpointIps is provided")), errors);
    }

    @Test
    void endpointIdDoesNotRequireIps() throws Exception {
        assertPasses("{\"prefix\": \"test-app\", \"vpc\": {\"s3VpcEndpointId\": \"vpce-0123abcd\"}}");
        assertPasses("{\"prefix\": \"test-app\", \"vpc\": {\"s3VpcEndpointIps\": []}}");
    }

    @Test
    void acceptsEndpointIpsWithEndpointId() throws Exception {
        assertPasses("""
                {"prefix": "test-app", "vpc": {"s3VpcEndpointId": "vpce-0123abcd", "s3VpcEndpointIps": ["10.0.1.5", "10.0.2.5"]}}
                """);
    }

    @Test
    void rejectsInvalidIpAddress() throws Exception {
        List<FieldError> errors = assertFails("""
                {"prefix": "test-app", "vpc": {"s3VpcEndpointId": "vpce-0123abcd", "s3VpcEndpointIps": ["999.0.0.1"]}}
                """);
        assertEquals(List.of("vpc.s3VpcEndpointIps.0"), paths(errors));
    }

    @Test
    void skipsRefinementWhenReferencedFieldHasWrongKind() throws Exception {
        List<FieldError> errors = assertFails("""
                {"prefix": "test-app", "vpc": {"s3VpcEndpointId": false, "s3VpcEndpointIps": ["10.0.1.5"]}}
                """);
        assertEquals(List.of(new FieldError("vpc.s3VpcEndpointId", "Expected string, received boolean")), errors);
    }

    @Test
    void explicitNullIsATypeError() throws Exception {
        List<FieldError> errors = assertFails("{\"prefix\": \"test-app\", \"enableWaf\": null}");
        assertEquals(List.of(new FieldError("enableWaf", "Expected boolean, received null")), errors);
    }

    @Test
    void acceptsDisabledFederation() throws Exception {
        assertPasses("{\"prefix\": \"test-app\", \"cognitoFederation\": {\"enabled\": false}}");
    }

    @Test
    void samlTypeRequiresMetadataUrl() throws Exception {
        List<FieldError> errors = assertFails("""
                {
                  "prefix": "test-app",
                  "cognitoFederation": {"enabled": true, "customProviderName": "Corp", "customProviderType": "SAML"}
                }
                """);
        assertEquals(List.of(new FieldError("cognitoFederation.customSAML.metadataDocumentUrl",
                "SAML metadata URL is required when provider type is SAML")), errors);
    }

    @Test
    void oidcTypeRequiresOidcConfiguration() throws Exception {
        List<FieldError> errors = assertFails("""
                {
                  "prefix": "test-app",
                  "cognitoFederation": {"enabled": true, "customProviderName": "Corp", "customProviderType": "OIDC"}
                }
                """);
        assertEquals(List.of("cognitoFederation.customOIDC"), paths(errors));
    }

    @Test
    void acceptsOidcConfiguration() throws Exception {
        DeploymentManifest manifest = assertPasses("""
                {
                  "prefix": "test-app",
                  "cognitoFederation": {
                    "enabled": true,
                    "customProviderName": "Corp",
                    "customProviderType": "OIDC",
                    "customOIDC": {
                      "OIDCClient": "client-123",
                      "OIDCSecret": "arn:aws:secretsmanager:us-east-1:123456789012:secret:oidc-abc",
                      "OIDCIssuerURL": "https://login.example.com"
                    }
                  }
                }
                """);
        assertEquals("client-123",
                manifest.asPartialConfig().getCognitoFederation().getCustomOIDC().getClientId());
    }

    @Test
    void rejectsNonHttpsSamlUrl() throws Exception {
        List<FieldError> errors = assertFails("""
                {
                  "prefix": "test-app",
                  "cognitoFederation": {
                    "enabled": true,
                    "customProviderName": "Corp",
                    "customProviderType": "SAML",
                    "customSAML": {"metadataDocumentUrl": "http://idp.example.com/metadata.xml"}
                  }
                }
                """);
        assertEquals(List.of(new FieldError("cognitoFederation.customSAML.metadataDocumentUrl",
                "SAML metadata URL must use HTTPS")), errors);
    }

    @Test
    void enabledFederationRequiresProviderNameUnlessLater() throws Exception {
        List<FieldError> errors = assertFails("""
                {
                  "prefix": "test-app",
                  "cognitoFederation": {
                    "enabled": true,
                    "customProviderType": "SAML",
                    "customSAML": {"metadataDocumentUrl": "https://idp.example.com/metadata.xml"}
                  }
                }
                """);
        assertEquals(List.of("cognitoFederation.customProviderName"), paths(errors));

        assertPasses("""
                {"prefix": "test-app", "cognitoFederation": {"enabled": true, "customProviderType": "later"}}
                """);
    }

    @Test
    void rejectsUnknownProviderType() throws Exception {
        List<FieldError> errors = assertFails("""
                {"prefix": "test-app", "cognitoFederation": {"customProviderType": "LDAP"}}
                """);
        assertEquals(List.of(new FieldError("cognitoFederation.customProviderType",
                "Invalid enum value. Expected 'SAML' | 'OIDC' | 'later', received 'LDAP'")), errors);
    }

    @Test
    void enabledGuardrailsRequireIdentifierAndVersion() throws Exception {
        List<FieldError> errors = assertFails("""
                {"prefix": "test-app", "bedrock": {"guardrails": {"enabled": true}}}
                """);
        assertEquals(List.of("bedrock.guardrails.identifier", "bedrock.guardrails.version"), paths(errors));
    }

    @Test
    void acceptsDisabledAndCompleteGuardrails() throws Exception {
        assertPasses("{\"prefix\": \"test-app\", \"bedrock\": {\"guardrails\": {\"enabled\": false}}}");
        assertPasses("""
                {"prefix": "test-app", "bedrock": {"guardrails": {"enabled": true, "identifier": "abc123def456", "version": "1"}}}
                """);
    }

    @Test
    void guardrailsRequireEnabledFlag() throws Exception {
        List<FieldError> errors = assertFails("""
                {"prefix": "test-app", "bedrock": {"guardrails": {"identifier": "abc"}}}
                """);
        assertEquals(List.of(new FieldError("bedrock.guardrails.enabled", "Required")), errors);
    }

    @Test
    void enabledRagRequiresAnActiveEngine() throws Exception {
        List<FieldError> errors = assertFails("{\"prefix\": \"test-app\", \"rag\": {\"enabled\": true}}");
        assertEquals(List.of(new FieldError("rag.engines",
                "At least one RAG engine (OpenSearch or Knowledge Base) must be enabled when RAG is enabled")), errors);

        assertFails("""
                {"prefix": "test-app", "rag": {"enabled": true, "engines": {"opensearch": {"enabled": false}}}}
                """);
        assertPasses("""
                {"prefix": "test-app", "rag": {"enabled": true, "engines": {"opensearch": {"enabled": true}}}}
                """);
        assertPasses("{\"prefix\": \"test-app\", \"rag\": {\"enabled\": false}}");
    }

    @Test
    void rejectsShortKnowledgeBaseId() throws Exception {
        List<FieldError> errors = assertFails("""
                {
                  "prefix": "test-app",
                  "rag": {
                    "enabled": true,
                    "engines": {
                      "knowledgeBase": {"enabled": true, "external": [{"name": "my-kb", "knowledgeBaseId": "short"}]}
                    }
                  }
                }
                """);
        assertTrue(errors.stream().allMatch(e -> e.path().equals("rag.engines.knowledgeBase.external.0.knowledgeBaseId")));
        assertTrue(errors.stream().anyMatch(e -> e.message().equals("Knowledge Base ID must be exactly 10 characters")));
    }

    @Test
    void rejectsNonPositiveModelDimensions() throws Exception {
        List<FieldError> errors = assertFails("""
                {"prefix": "test-app", "rag": {"embeddingsModels": [{"provider": "bedrock", "name": "m", "dimensions": 0}]}}
                """);
        assertEquals(List.of(new FieldError("rag.embeddingsModels.0.dimensions", "Dimensions must be a positive number")),
                errors);
    }

    @Test
    void certificateAndDomainFormats() throws Exception {
        assertPasses("""
                {"prefix": "test-app", "certificate": "arn:aws:acm:il-central-1:123456789012:certificate/aaaaaaaa-bbbb-cccc-dddd-eeeeeeeeeeee"}
                """);
        assertEquals(List.of("certificate"), paths(assertFails("{\"prefix\": \"test-app\", \"certificate\": \"invalid-arn\"}")));
        assertPasses("{\"prefix\": \"test-app\", \"domain\": \"chat.example.com\"}");
        assertEquals(List.of("domain"), paths(assertFails("{\"prefix\": \"test-app\", \"domain\": \"invalid domain\"}")));
    }

    @Test
    void emptyStringSkipsFormatChecksWhereAllowed() throws Exception {
        DeploymentManifest manifest = assertPasses("""
                {"prefix": "test-app", "certificate": "", "domain": "", "logArchiveBucketName": "",
                 "cloudfrontLogBucketArn": "", "bedrock": {"roleArn": ""}}
                """);
        assertEquals("", manifest.get("logArchiveBucketName").orElseThrow().textValue());
        assertEquals(List.of("vpc.vpcId"), paths(assertFails("{\"prefix\": \"test-app\", \"vpc\": {\"vpcId\": \"\"}}")));
    }

    @Test
    void logRetentionAndRateLimitBounds() throws Exception {
        assertPasses("{\"prefix\": \"test-app\", \"logRetention\": 14, \"rateLimitPerIP\": 10}");
        List<FieldError> errors = assertFails("{\"prefix\": \"test-app\", \"logRetention\": 8, \"rateLimitPerIP\": 9}");
        assertEquals(List.of("logRetention", "rateLimitPerIP"), paths(errors));
        assertEquals("Rate limit per IP must be at least 10", errors.get(1).message());
    }

    @Test
    void rejectsProvisionedConcurrencyBeyondIntRange() throws Exception {
        assertEquals(List.of(new FieldError("provisionedConcurrency", "Number must be less than or equal to 2147483647")),
                assertFails("{\"prefix\": \"test-app\", \"provisionedConcurrency\": 3000000000}"));
    }

    @Test
    void rejectsRateLimitBeyondIntRange() throws Exception {
        assertEquals(List.of(new FieldError("rateLimitPerIP", "Number must be less than or equal to 2147483647")),
                assertFails("{\"prefix\": \"test-app\", \"rateLimitPerIP\": 3000000000}"));
        assertEquals(List.of(new FieldError("rateLimitPerIP", "Number must be greater than or equal to -2147483648")),
                assertFails("{\"prefix\": \"test-app\", \"rateLimitPerIP\": -3000000000}"));
    }

    @Test
    void rejectsModelDimensionsBeyondIntRange() throws Exception {
        List<FieldError> errors = assertFails("""
                {"prefix": "test-app", "rag": {"embeddingsModels": [{"provider": "bedrock", "name": "m", "dimensions": 3000000000}]}}
                """);
        assertEquals(List.of(new FieldError("rag.embeddingsModels.0.dimensions",
                "Number must be less than or equal to 2147483647")), errors);
    }

    @Test
    void acceptsLargestIntValue() throws Exception {
        assertPasses("{\"prefix\": \"test-app\", \"provisionedConcurrency\": 2147483647}");
    }

    @Test
    void geoRestrictionNeedsCountries() throws Exception {
        List<FieldError> errors = assertFails("{\"prefix\": \"test-app\", \"cfGeoRestrictEnable\": true}");
        assertEquals(List.of("cfGeoRestrictList"), paths(errors));
        assertEquals(List.of("cfGeoRestrictList.1"), paths(assertFails("""
                {"prefix": "test-app", "cfGeoRestrictEnable": true, "cfGeoRestrictList": ["US", "USA"]}
                """)));
        assertPasses("{\"prefix\": \"test-app\", \"cfGeoRestrictEnable\": true, \"cfGeoRestrictList\": [\"US\", \"DE\"]}");
    }

    @Test
    void repositoryChoiceIsExclusive() throws Exception {
        List<FieldError> both = assertFails("""
                {"prefix": "test-app", "pipeline": {"enabled": true,
                  "codecommit": {"existingRepositoryName": "repo", "createNew": true, "newRepositoryName": "fresh"}}}
                """);
        assertEquals(List.of(new FieldError("pipeline.codecommit",
                "Provide either existingRepositoryName OR createNew: true, not both")), both);

        List<FieldError> neither = assertFails("""
                {"prefix": "test-app", "pipeline": {"enabled": true, "codecommit": {}}}
                """);
        assertEquals(List.of("pipeline.codecommit"), paths(neither));
    }

    @Test
    void createNewRequiresRepositoryName() throws Exception {
        List<FieldError> errors = assertFails("""
                {"prefix": "test-app", "pipeline": {"enabled": true, "codecommit": {"createNew": true}}}
                """);
        assertEquals(List.of(new FieldError("pipeline.codecommit.newRepositoryName",
                "newRepositoryName is required when createNew is true")), errors);
    }

    @Test
    void pipelineRequiresCodecommitAndEnabled() throws Exception {
        List<FieldError> errors = assertFails("{\"prefix\": \"test-app\", \"pipeline\": {}}");
        assertEquals(List.of("pipeline.enabled", "pipeline.codecommit"), paths(errors));
    }

    @Test
    void appliesDefaultsInsidePipelineAndExternalIndexes() throws Exception {
        DeploymentManifest manifest = assertPasses("""
                {
                  "prefix": "test-app",
                  "pipeline": {"codecommit": {"existingRepositoryName": "repo"}, "enabled": true},
                  "rag": {"engines": {"knowledgeBase": {"enabled": true,
                    "external": [{"name": "kb", "knowledgeBaseId": "ABCD123456"}]}}}
                }
                """);
        assertEquals("main", manifest.get("pipeline.branch").orElseThrow().textValue());
        assertTrue(manifest.get("pipeline.requireApproval").orElseThrow().booleanValue());
        assertFalse(manifest.get("pipeline.codecommit.seedOnCreate").orElseThrow().booleanValue());
        assertTrue(manifest.get("rag.engines.knowledgeBase.external.0.enabled").orElseThrow().booleanValue());

        Iterator<String> order = manifest.get("pipeline").orElseThrow().fieldNames();
        assertEquals("codecommit", order.next());
        assertEquals("enabled", order.next());
        assertEquals("branch", order.next());
        assertEquals("requireApproval", order.next());
    }

    @Test
    void doesNotDefaultOutsideReplacedGroups() throws Exception {
        DeploymentManifest manifest = assertPasses("{\"prefix\": \"test-app\", \"vpc\": {}}");
        assertEquals(MAPPER.readTree("{\"prefix\": \"test-app\", \"vpc\": {}}"), manifest.getDocument());
    }

    @Test
    void dropsUnknownFields() throws Exception {
        DeploymentManifest manifest = assertPasses("""
                {"prefix": "test-app", "llms": {"sagemaker": []}, "vpc": {"vpcId": "vpc-0123abcd", "extra": 1}}
                """);
        assertFalse(manifest.has("llms"));
        assertFalse(manifest.has("vpc.extra"));
        assertTrue(manifest.has("vpc.vpcId"));
    }

    @Test
    void collectsIndependentViolations() throws Exception {
        List<FieldError> errors = assertFails("""
                {
                  "prefix": "1bad",
                  "enableWaf": "yes",
                  "domain": "not a domain",
                  "logRetention": 8,
                  "vpc": {"vpcId": "vpc-nothex"},
                  "bedrock": {"guardrails": {"enabled": true, "identifier": "abc", "version": "1"}, "region": "mars-1"}
                }
                """);
        assertTrue(errors.size() >= 6, () -> "only " + errors);
        assertEquals(List.of("prefix", "enableWaf", "logRetention", "domain", "vpc.vpcId", "bedrock.region"),
                paths(errors));
    }

    @Test
    void rootMustBeAnObject() throws Exception {
        List<FieldError> errors = assertFails("[1, 2]");
        assertEquals("root: Expected object, received array", errors.get(0).format());

        ValidationResult empty = validator.validate(MissingNode.getInstance());
        assertEquals("root: Required", empty.formatErrors());
    }

    @Test
    void acceptsCompleteManifest() throws Exception {
        JsonNode complete = MAPPER.readTree("""
                {
                  "prefix": "prod-cb",
                  "enableWaf": true,
                  "createCMKs": true,
                  "advancedMonitoring": true,
                  "privateWebsite": true,
                  "certificate": "arn:aws:acm:il-central-1:123456789012:certificate/aaaaaaaa-bbbb-cccc-dddd-eeeeeeeeeeee",
                  "domain": "chat.example.com",
                  "vpc": {
                    "vpcId": "vpc-0123456789abcdef0",
                    "subnetIds": ["subnet-0123456789abcdef0", "subnet-0123456789abcdef1"],
                    "executeApiVpcEndpointId": "vpce-0123456789abcdef0",
                    "s3VpcEndpointId": "vpce-0123456789abcdef1",
                    "s3VpcEndpointIps": ["10.0.1.100", "10.0.2.100"]
                  },
                  "cognitoFederation": {
                    "enabled": true,
                    "autoRedirect": true,
                    "customProviderName": "EnterpriseSSO",
                    "customProviderType": "SAML",
                    "cognitoDomain": "my-chatbot",
                    "customSAML": {"metadataDocumentUrl": "https://idp.example.com/metadata.xml"}
                  },
                  "bedrock": {"guardrails": {"enabled": true, "identifier": "abc123def456", "version": "1"}},
                  "rag": {
                    "enabled": true,
                    "crossEncodingEnabled": false,
                    "engines": {
                      "opensearch": {"enabled": true},
                      "knowledgeBase": {
                        "enabled": true,
                        "external": [
                          {"name": "my-knowledge-base", "knowledgeBaseId": "ABCD123456", "region": "il-central-1", "enabled": true}
                        ]
                      }
                    },
                    "embeddingsModels": [
                      {"provider": "bedrock", "name": "amazon.titan-embed-text-v1", "dimensions": 1536, "default": true}
                    ]
                  }
                }
                """);
        ValidationResult result = validator.validate(complete);
        assertTrue(result.isValid(), result::formatErrors);
        assertEquals(complete, result.getManifest().orElseThrow().getDocument());
    }
}
