package com.cloudcost.awspricing.api;

import com.cloudcost.awspricing.actual.ActualCostRequest;
import com.cloudcost.awspricing.actual.ActualCostService;
import com.cloudcost.awspricing.config.EngineSettings;
import com.cloudcost.awspricing.domain.model.ActualCostResult;
import com.cloudcost.awspricing.domain.model.CostEstimate;
import com.cloudcost.awspricing.domain.model.MetricKind;
import com.cloudcost.awspricing.domain.model.PricingSpec;
import com.cloudcost.awspricing.domain.model.ResourceDescriptor;
import com.cloudcost.awspricing.domain.model.SupportsResult;
import com.cloudcost.awspricing.estimation.PricingSpecService;
import com.cloudcost.awspricing.estimation.ProjectedCostService;
import com.cloudcost.awspricing.estimation.SupportsService;
import com.cloudcost.awspricing.exception.GlobalExceptionHandler;
import com.cloudcost.awspricing.exception.InvalidResourceException;
import com.cloudcost.awspricing.exception.RegionMismatchException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class CostControllerTest {

    @Mock
    private ProjectedCostService projectedCostService;

    @Mock
    private ActualCostService actualCostService;

    @Mock
    private PricingSpecService pricingSpecService;

    @Mock
    private SupportsService supportsService;

    private MockMvc mockMvc;

    private static final String EC2_RESOURCE = """
            {"provider":"aws","resourceType":"aws:ec2/instance:Instance","sku":"t3.micro","region":"us-east-1"}""";

    @BeforeEach
    void setUp() {
        CostController controller = new CostController(projectedCostService, actualCostService,
                pricingSpecService, supportsService, EngineSettings.defaults("us-east-1"));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .addFilters(new TraceContextFilter())
                .build();
    }

    @Nested
    @DisplayName("Projected Cost Tests")
    class ProjectedCostTests {

        @Test
        @DisplayName("Should return the projected estimate")
        void shouldReturnEstimate() throws Exception {
            // Given
            when(projectedCostService.getProjectedCost(any(ResourceDescriptor.class), eq(0.8)))
                    .thenReturn(CostEstimate.of(7.592, 0.0104, "On-demand Linux, Shared tenancy, 730 hrs/month"));

            // When / Then
            mockMvc.perform(post("/api/v1/costs/projected")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"resource\":" + EC2_RESOURCE + ",\"utilizationPercentage\":0.8}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.costPerMonth").value(7.592))
                    .andExpect(jsonPath("$.currency").value("USD"))
                    .andExpect(header().exists(TraceContext.HEADER));
        }

        @Test
        @DisplayName("Should reject utilization outside [0, 1]")
        void shouldRejectUtilization() throws Exception {
            mockMvc.perform(post("/api/v1/costs/projected")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"resource\":" + EC2_RESOURCE + ",\"utilizationPercentage\":1.5}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value("Validation Failed"))
                    .andExpect(jsonPath("$.details.utilizationPercentage").exists());

            verifyNoInteractions(projectedCostService);
        }

        @Test
        @DisplayName("Should answer 412 with routing details on region mismatch")
        void shouldAnswerPreconditionFailed() throws Exception {
            // Given
            when(projectedCostService.getProjectedCost(any(), any()))
                    .thenThrow(new RegionMismatchException("us-east-1", "eu-west-1"));

            // When / Then
            mockMvc.perform(post("/api/v1/costs/projected")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"resource\":" + EC2_RESOURCE + "}"))
                    .andExpect(status().isPreconditionFailed())
                    .andExpect(jsonPath("$.error_code").value("UNSUPPORTED_REGION"))
                    .andExpect(jsonPath("$.details.required_region").value("eu-west-1"))
                    .andExpect(jsonPath("$.details.plugin_region").value("us-east-1"));
        }

        @Test
        @DisplayName("Should answer 400 for invalid resources")
        void shouldAnswerBadRequest() throws Exception {
            when(projectedCostService.getProjectedCost(any(), any()))
                    .thenThrow(new InvalidResourceException("only \"aws\" provider is supported"));

            mockMvc.perform(post("/api/v1/costs/projected")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"resource\":" + EC2_RESOURCE + "}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error_code").value("INVALID_RESOURCE"))
                    .andExpect(jsonPath("$.message").value("only \"aws\" provider is supported"));
        }

        @Test
        @DisplayName("Should answer 400 for malformed JSON")
        void shouldRejectMalformedJson() throws Exception {
            mockMvc.perform(post("/api/v1/costs/projected")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"resource\":"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value("Malformed request body"));
        }
    }

    @Nested
    @DisplayName("Other Operation Tests")
    class OtherOperationTests {

        @Test
        @DisplayName("Should pass the actual-cost window through")
        void shouldPassActualCostWindow() throws Exception {
            // Given
            Instant start = Instant.parse("2025-03-01T00:00:00Z");
            when(actualCostService.getActualCost(any(ActualCostRequest.class)))
                    .thenReturn(List.of(new ActualCostResult(start, 0.2496, 24, "hours", "aws-public-fallback", null)));

            // When
            mockMvc.perform(post("/api/v1/costs/actual")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"arn":"arn:aws:ec2:us-east-1:1:instance/i-1","tags":{"sku":"t3.micro"},
                                     "start":"2025-03-01T00:00:00Z","end":"2025-03-02T00:00:00Z"}"""))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.results[0].cost").value(0.2496))
                    .andExpect(jsonPath("$.results[0].usageUnit").value("hours"));

            // Then
            ArgumentCaptor<ActualCostRequest> captor = ArgumentCaptor.forClass(ActualCostRequest.class);
            verify(actualCostService).getActualCost(captor.capture());
            assertThat(captor.getValue().start()).isEqualTo(start);
            assertThat(captor.getValue().end()).isEqualTo(Instant.parse("2025-03-02T00:00:00Z"));
            assertThat(captor.getValue().tags()).containsEntry("sku", "t3.micro");
        }

        @Test
        @DisplayName("Should estimate from attributes")
        void shouldEstimateFromAttributes() throws Exception {
            when(projectedCostService.estimateFromAttributes(eq("aws:ebs/volume:Volume"), anyMap())).thenReturn(8.0);

            mockMvc.perform(post("/api/v1/costs/estimate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"resourceType\":\"aws:ebs/volume:Volume\",\"attributes\":{\"type\":\"gp3\",\"size\":100}}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.costMonthly").value(8.0));
        }

        @Test
        @DisplayName("Should require a resource type for estimates")
        void shouldRequireResourceType() throws Exception {
            mockMvc.perform(post("/api/v1/costs/estimate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"attributes\":{}}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.details.resourceType").exists());
        }

        @Test
        @DisplayName("Should return pricing spec")
        void shouldReturnPricingSpec() throws Exception {
            ResourceDescriptor ebs = ResourceDescriptor.of("aws", "ebs", "gp3", "us-east-1", Map.of());
            when(pricingSpecService.getPricingSpec(any())).thenReturn(PricingSpec.forResource(
                    ebs, "gp3", "per_gb_month", 0.08, "GB-month", "EBS gp3 storage", List.of()));

            mockMvc.perform(post("/api/v1/pricing-spec")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"resource\":{\"provider\":\"aws\",\"resourceType\":\"ebs\",\"sku\":\"gp3\",\"region\":\"us-east-1\"}}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.billingMode").value("per_gb_month"))
                    .andExpect(jsonPath("$.ratePerUnit").value(0.08));
        }

        @Test
        @DisplayName("Should answer supports without validation errors")
        void shouldAnswerSupports() throws Exception {
            when(supportsService.supports(any()))
                    .thenReturn(new SupportsResult(true, "", List.of(MetricKind.CARBON_FOOTPRINT)));

            mockMvc.perform(post("/api/v1/supports")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"resource\":" + EC2_RESOURCE + "}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.supported").value(true))
                    .andExpect(jsonPath("$.supportedMetrics[0]").exists());
        }

        @Test
        @DisplayName("Should describe the engine")
        void shouldDescribeEngine() throws Exception {
            mockMvc.perform(get("/api/v1/info").header(TraceContext.HEADER, "trace-123"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.name").value("aws-public-pricing"))
                    .andExpect(jsonPath("$.providers[0]").value("aws"))
                    .andExpect(jsonPath("$.metadata.region").value("us-east-1"))
                    .andExpect(header().string(TraceContext.HEADER, "trace-123"));
        }
    }
}
