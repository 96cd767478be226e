package com.ai.leadqualifier.app;

import com.ai.leadqualifier.provider.AiProvider;
import com.ai.leadqualifier.repository.CrmLeadRepository;
import com.ai.leadqualifier.service.QualificationEngine;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = LeadQualifierApplication.class)
@AutoConfigureMockMvc
class LeadQualifierApplicationTests {

    @MockBean
    private AiProvider provider;

    @Autowired
    private QualificationEngine engine;

    @Autowired
    private CrmLeadRepository repository;

    @Autowired
    private MockMvc mvc;

    @Test
    void contextLoadsWithConfiguredCriteria() {
        assertThat(engine.getProvider()).isSameAs(provider);
        assertThat(engine.getCriteria().getRequiredFields()).containsExactly("name", "phone");
        assertThat(engine.getCriteria().getMinScore()).isEqualTo(50);
    }

    @Test
    void optOutThroughWebhookCreatesCrmLead() throws Exception {
        Map<String, Object> nothing = new HashMap<>();
        nothing.put("name", null);
        when(provider.extractStructuredData(anyString(), anyMap())).thenReturn(nothing);

        mvc.perform(post("/api/ai/webhook/whatsapp")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phone\":\"5511977776666\",\"message\":\"me tire da lista\",\"name\":\"Carla\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("disqualified"))
                .andExpect(jsonPath("$.crm_lead_created").value(true))
                .andExpect(jsonPath("$.data.crm_data.name").value("Carla"));

        assertThat(repository.findByPhoneOrderByCreatedAtDesc("5511977776666"))
                .hasSize(1)
                .allSatisfy(lead -> assertThat(lead.getStatus()).isEqualTo("disqualified"));

        mvc.perform(get("/api/ai/conversations/5511977776666"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.conversation.status").value("disqualified"));
    }
}
