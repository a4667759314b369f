package com.cbd.manifest.schema;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import static com.cbd.manifest.schema.Conditions.allOf;
import static com.cbd.manifest.schema.Conditions.isTrue;
import static com.cbd.manifest.schema.Conditions.not;
import static com.cbd.manifest.schema.Conditions.textEquals;
import static com.cbd.manifest.schema.Conditions.truthy;
import static com.cbd.manifest.schema.Constraints.allowedIntegers;
import static com.cbd.manifest.schema.Constraints.email;
import static com.cbd.manifest.schema.Constraints.exactLength;
import static com.cbd.manifest.schema.Constraints.httpsOnly;
import static com.cbd.manifest.schema.Constraints.maxLength;
import static com.cbd.manifest.schema.Constraints.minItems;
import static com.cbd.manifest.schema.Constraints.minLength;
import static com.cbd.manifest.schema.Constraints.minimum;
import static com.cbd.manifest.schema.Constraints.oneOf;
import static com.cbd.manifest.schema.Constraints.pattern;
import static com.cbd.manifest.schema.Constraints.positive;
import static com.cbd.manifest.schema.Constraints.url;

/**
 * Rule table of the deployment manifest: every field a manifest may set, with its kind, format
 * checks and cross-field rules. Pure data; {@link SchemaValidator} interprets it.
 */
public final class ManifestSchema {

    public static final List<String> SUPPORTED_REGIONS = List.of(
            "af-south-1", "ap-east-1", "ap-northeast-1", "ap-northeast-2", "ap-northeast-3",
            "ap-south-1", "ap-south-2", "ap-southeast-1", "ap-southeast-2", "ap-southeast-3",
            "ap-southeast-4", "ca-central-1", "eu-central-1", "eu-central-2", "eu-north-1",
            "eu-south-1", "eu-south-2", "eu-west-1", "eu-west-2", "eu-west-3", "il-central-1",
            "me-central-1", "me-south-1", "sa-east-1", "us-east-1", "us-east-2", "us-west-1",
            "us-west-2");

    /** CloudWatch Logs retention periods, in days. */
    public static final List<Integer> LOG_RETENTION_DAYS = List.of(
            1, 3, 5, 7, 14, 30, 60, 90, 120, 150, 180, 365, 400, 545, 731, 1096, 1827, 2192,
            2557, 2922, 3288, 3653);

    public static final List<String> MODEL_PROVIDERS = List.of("sagemaker", "bedrock", "openai", "nexus");

    public static final List<String> FEDERATION_PROVIDER_TYPES = List.of("SAML", "OIDC", "later");

    private static final String IAM_ROLE_ARN = "^arn:aws:iam::\\d{12}:role/.+$";
    private static final String REPOSITORY_NAME = "^[a-zA-Z0-9._-]+$";
    private static final String REPOSITORY_NAME_MESSAGE =
            "Invalid CodeCommit repository name. Only alphanumeric, dots, hyphens, and underscores.";
    private static final String IPV4_OCTET = "(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)";

    static final ObjectSchema VPC = ObjectSchema.builder()
            .field(FieldSpec.string("vpcId").check(pattern("^vpc-[a-f0-9]{8,17}$",
                    "Invalid VPC ID format. Expected: vpc-xxxxxxxx or vpc-xxxxxxxxxxxxxxxxx")))
            .field(FieldSpec.array("subnetIds", FieldSpec.stringItem()
                            .check(pattern("^subnet-[a-f0-9]{8,17}$",
                                    "Invalid subnet ID format. Expected: subnet-xxxxxxxx"))
                            .build())
                    .check(minItems(1, "At least one subnet ID is required when specifying subnetIds")))
            .field(FieldSpec.bool("createVpcEndpoints"))
            .field(FieldSpec.string("executeApiVpcEndpointId").check(pattern("^vpce-[a-f0-9]+$",
                    "Invalid VPC endpoint ID format. Expected: vpce-xxxxxxxx")))
            .field(FieldSpec.string("s3VpcEndpointId").check(pattern("^vpce-[a-f0-9]+$",
                    "Invalid S3 VPC endpoint ID format. Expected: vpce-xxxxxxxx")))
            .field(FieldSpec.array("s3VpcEndpointIps", FieldSpec.stringItem()
                    .check(pattern("^(" + IPV4_OCTET + "\\.){3}" + IPV4_OCTET + "$",
                            "Invalid IP address format. Expected: x.x.x.x"))
                    .build()))
            .refine(Refinements.companionPair("s3VpcEndpointIps", "s3VpcEndpointId",
                    "s3VpcEndpointId is required when s3VpcEndpointIps is provided"))
            .build();

    static final ObjectSchema SAML_PROVIDER = ObjectSchema.builder()
            .field(FieldSpec.string("metadataDocumentUrl").required()
                    .check(url("Invalid SAML metadata URL"), httpsOnly("SAML metadata URL must use HTTPS")))
            .build();

    static final ObjectSchema OIDC_PROVIDER = ObjectSchema.builder()
            .field(FieldSpec.string("OIDCClient").required().check(
                    minLength(1, "OIDC Client ID is required"),
                    maxLength(255, "OIDC Client ID must be at most 255 characters"),
                    pattern("^[a-zA-Z0-9_-]+$",
                            "OIDC Client ID must contain only alphanumeric characters, hyphens, and underscores")))
            .field(FieldSpec.string("OIDCSecret").required().check(
                    pattern("^arn:aws:secretsmanager:[a-z0-9-]+:\\d{12}:secret:.+$",
                            "Invalid Secrets Manager ARN format. Expected: arn:aws:secretsmanager:region:account-id:secret:name")))
            .field(FieldSpec.string("OIDCIssuerURL").required()
                    .check(url("Invalid OIDC Issuer URL"), httpsOnly("OIDC Issuer URL must use HTTPS")))
            .build();

    static final ObjectSchema COGNITO_FEDERATION = ObjectSchema.builder()
            .field(FieldSpec.bool("enabled"))
            .field(FieldSpec.bool("autoRedirect"))
            .field(FieldSpec.string("customProviderName").check(
                    minLength(1, "Provider name is required when federation is enabled"),
                    maxLength(32, "Provider name must be at most 32 characters"),
                    pattern("^[a-zA-Z0-9_-]+$",
                            "Provider name must contain only alphanumeric characters, hyphens, and underscores")))
            .field(FieldSpec.string("customProviderType").check(oneOf(FEDERATION_PROVIDER_TYPES)))
            .field(FieldSpec.string("cognitoDomain").check(pattern("^[a-z0-9-]+$",
                    "Cognito domain must contain only lowercase letters, numbers, and hyphens")))
            .field(FieldSpec.object("customSAML", SAML_PROVIDER))
            .field(FieldSpec.object("customOIDC", OIDC_PROVIDER))
            .refine(Refinements.requiredByDiscriminant("enabled", "customProviderType", "SAML",
                    "customSAML.metadataDocumentUrl",
                    "SAML metadata URL is required when provider type is SAML",
                    "customSAML.metadataDocumentUrl"))
            .refine(Refinements.requiredByDiscriminant("enabled", "customProviderType", "OIDC",
                    "customOIDC",
                    "OIDC configuration (OIDCClient, OIDCSecret, OIDCIssuerURL) is required when provider type is OIDC",
                    "customOIDC.OIDCClient", "customOIDC.OIDCSecret", "customOIDC.OIDCIssuerURL"))
            .refine(Refinement.named("provider-name-when-enabled")
                    .references("enabled", "customProviderType", "customProviderName")
                    .when(allOf(isTrue("enabled"), not(textEquals("customProviderType", "later"))))
                    .require(truthy("customProviderName"))
                    .reportAt("customProviderName")
                    .message("Provider name is required when federation is enabled")
                    .build())
            .build();

    static final ObjectSchema GUARDRAILS = ObjectSchema.builder()
            .field(FieldSpec.bool("enabled").required())
            .field(FieldSpec.string("identifier").check(pattern("^[a-z0-9]+$",
                    "Guardrail identifier must contain only lowercase alphanumeric characters")))
            .field(FieldSpec.string("version"))
            .refine(Refinements.featureGate("enabled", "identifier",
                    "Guardrail identifier is required when guardrails are enabled"))
            .refine(Refinements.featureGate("enabled", "version",
                    "Guardrail version is required when guardrails are enabled"))
            .build();

    static final ObjectSchema BEDROCK = ObjectSchema.builder()
            .field(FieldSpec.bool("enabled"))
            .field(FieldSpec.string("region").check(oneOf(SUPPORTED_REGIONS, "Unsupported AWS region")))
            .field(FieldSpec.string("roleArn").allowEmptyString()
                    .check(pattern(IAM_ROLE_ARN, "Invalid IAM role ARN format")))
            .field(FieldSpec.object("guardrails", GUARDRAILS))
            .build();

    static final ObjectSchema EXTERNAL_KNOWLEDGE_BASE = ObjectSchema.builder()
            .field(FieldSpec.string("name").required().check(
                    minLength(1, "Knowledge Base name is required"),
                    pattern("^[a-zA-Z0-9_-]+$",
                            "Name must contain only alphanumeric characters, hyphens, and underscores")))
            .field(FieldSpec.string("knowledgeBaseId").required().check(
                    exactLength(10, "Knowledge Base ID must be exactly 10 characters"),
                    pattern("^[A-Z0-9]+$", "Knowledge Base ID must be uppercase alphanumeric")))
            .field(FieldSpec.string("region").check(oneOf(SUPPORTED_REGIONS, "Unsupported AWS region")))
            .field(FieldSpec.string("roleArn").check(pattern(IAM_ROLE_ARN, "Invalid IAM role ARN format")))
            .field(FieldSpec.bool("enabled").defaultValue(true))
            .build();

    static final ObjectSchema MODEL = ObjectSchema.builder()
            .field(FieldSpec.string("provider").required().check(oneOf(MODEL_PROVIDERS)))
            .field(FieldSpec.string("name").required().check(minLength(1, "Model name is required")))
            .field(FieldSpec.integer("dimensions").check(positive("Dimensions must be a positive number")))
            .field(FieldSpec.bool("default"))
            .build();

    static final ObjectSchema ENGINE_TOGGLE = ObjectSchema.builder()
            .field(FieldSpec.bool("enabled").required())
            .build();

    static final ObjectSchema KNOWLEDGE_BASE_ENGINE = ObjectSchema.builder()
            .field(FieldSpec.bool("enabled").required())
            .field(FieldSpec.array("external", FieldSpec.objectItem(EXTERNAL_KNOWLEDGE_BASE).build()))
            .build();

    static final ObjectSchema RAG_ENGINES = ObjectSchema.builder()
            .field(FieldSpec.object("opensearch", ENGINE_TOGGLE))
            .field(FieldSpec.object("aurora", ENGINE_TOGGLE))
            .field(FieldSpec.object("knowledgeBase", KNOWLEDGE_BASE_ENGINE))
            .build();

    static final ObjectSchema RAG = ObjectSchema.builder()
            .field(FieldSpec.bool("enabled"))
            .field(FieldSpec.bool("deployDefaultSagemakerModels"))
            .field(FieldSpec.bool("crossEncodingEnabled"))
            .field(FieldSpec.object("engines", RAG_ENGINES))
            .field(FieldSpec.array("embeddingsModels", FieldSpec.objectItem(MODEL).build()))
            .field(FieldSpec.array("crossEncoderModels", FieldSpec.objectItem(MODEL).build()))
            .refine(Refinements.anyActive("enabled", "engines",
                    "At least one RAG engine (OpenSearch or Knowledge Base) must be enabled when RAG is enabled",
                    "engines.opensearch.enabled", "engines.knowledgeBase.enabled"))
            .build();

    static final ObjectSchema CODECOMMIT = ObjectSchema.builder()
            .field(FieldSpec.string("existingRepositoryName").check(
                    minLength(1, "String must contain at least 1 character(s)"),
                    maxLength(100, "String must contain at most 100 character(s)"),
                    pattern(REPOSITORY_NAME, REPOSITORY_NAME_MESSAGE)))
            .field(FieldSpec.bool("createNew"))
            .field(FieldSpec.string("newRepositoryName").check(
                    minLength(1, "String must contain at least 1 character(s)"),
                    maxLength(100, "String must contain at most 100 character(s)"),
                    pattern(REPOSITORY_NAME, REPOSITORY_NAME_MESSAGE)))
            .field(FieldSpec.bool("seedOnCreate").defaultValue(false))
            .refine(Refinements.exactlyOneOf("existingRepositoryName", "createNew",
                    "Provide either existingRepositoryName OR createNew: true, not both"))
            .refine(Refinements.featureGate("createNew", "newRepositoryName",
                    "newRepositoryName is required when createNew is true"))
            .build();

    static final ObjectSchema PIPELINE = ObjectSchema.builder()
            .field(FieldSpec.bool("enabled").required())
            .field(FieldSpec.object("codecommit", CODECOMMIT).required())
            .field(FieldSpec.string("branch").check(minLength(1, "String must contain at least 1 character(s)"))
                    .defaultValue("main"))
            .field(FieldSpec.bool("requireApproval").defaultValue(true))
            .field(FieldSpec.string("notificationEmail").check(email("Invalid email address")))
            .build();

    /** Root of the manifest document. */
    public static final ObjectSchema ROOT = ObjectSchema.builder()
            .field(FieldSpec.string("prefix").required().check(
                    minLength(1, "Prefix is required"),
                    maxLength(16, "Prefix must be at most 16 characters"),
                    pattern("^[a-zA-Z][a-zA-Z0-9-]*$",
                            "Prefix must start with a letter and contain only letters, numbers, and hyphens")))
            .field(FieldSpec.bool("enableWaf"))
            .field(FieldSpec.bool("enableS3TransferAcceleration"))
            .field(FieldSpec.bool("directSend"))
            .field(FieldSpec.integer("provisionedConcurrency")
                    .check(minimum(0, "Provisioned concurrency must be zero or greater")))
            .field(FieldSpec.bool("createCMKs"))
            .field(FieldSpec.bool("retainOnDelete"))
            .field(FieldSpec.bool("ddbDeletionProtection"))
            .field(FieldSpec.bool("advancedMonitoring"))
            .field(FieldSpec.bool("disableS3AccessLogs"))
            .field(FieldSpec.string("logArchiveBucketName").allowEmptyString().check(
                    minLength(3, "S3 bucket name must be at least 3 characters"),
                    maxLength(63, "S3 bucket name must be at most 63 characters"),
                    pattern("^[a-z0-9][a-z0-9.-]*[a-z0-9]$",
                            "Invalid S3 bucket name format. Must start and end with lowercase letter or number.")))
            .field(FieldSpec.string("cloudfrontLogBucketArn").allowEmptyString().check(
                    pattern("^arn:aws:s3:::[a-z0-9][a-z0-9.-]*[a-z0-9]$",
                            "Invalid S3 bucket ARN format. Expected: arn:aws:s3:::bucket-name")))
            .field(FieldSpec.integer("logRetention").check(allowedIntegers(LOG_RETENTION_DAYS,
                    "Log retention must be one of: " + LOG_RETENTION_DAYS.stream()
                            .map(String::valueOf).collect(Collectors.joining(", ")))))
            .field(FieldSpec.integer("rateLimitPerIP").check(minimum(10, "Rate limit per IP must be at least 10")))
            .field(FieldSpec.bool("privateWebsite"))
            .field(FieldSpec.string("certificate").allowEmptyString().check(
                    pattern("^arn:aws:acm:[a-z0-9-]+:\\d{12}:certificate/[a-f0-9-]+$",
                            "Invalid ACM certificate ARN format")))
            .field(FieldSpec.string("domain").allowEmptyString().check(
                    pattern("^([a-zA-Z0-9]([a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?\\.)+[a-zA-Z]{2,}$",
                            "Invalid domain format. Example: chat.example.com")))
            .field(FieldSpec.bool("cfGeoRestrictEnable"))
            .field(FieldSpec.array("cfGeoRestrictList", FieldSpec.stringItem()
                    .check(oneOf(List.of(Locale.getISOCountries()),
                            "Invalid country code. Expected an ISO 3166-1 alpha-2 code such as US"))
                    .build()))
            .field(FieldSpec.object("vpc", VPC))
            .field(FieldSpec.object("cognitoFederation", COGNITO_FEDERATION))
            .field(FieldSpec.object("bedrock", BEDROCK))
            .field(FieldSpec.object("rag", RAG))
            .field(FieldSpec.object("pipeline", PIPELINE))
            .refine(Refinements.featureGate("cfGeoRestrictEnable", "cfGeoRestrictList",
                    "At least one country code is required when geo restriction is enabled"))
            .build();

    private ManifestSchema() {
    }
}
