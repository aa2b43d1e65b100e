package app.lexrecall.core.block;

import app.lexrecall.core.block.controller.StudyBlockController;
import app.lexrecall.core.card.domain.Card;
import app.lexrecall.core.card.domain.Subject;
import app.lexrecall.core.card.domain.Topic;
import app.lexrecall.core.common.error.ValidationException;
import app.lexrecall.core.support.TestCards;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(StudyBlockController.class)
@ActiveProfiles("test")
class StudyBlockControllerWebMvcTest {

    @Autowired
    MockMvc mockMvc;

    @MockitoBean
    StudyBlockService blockService;

    @Test
    void getBlock_passesFiltersThrough() throws Exception {
        Card card = TestCards.newCard(Topic.TORTS_DEFAMATION, 3);
        when(blockService.getStudyBlock(eq(5), eq(Subject.TORTS), eq(true), eq(false), eq(3)))
                .thenReturn(List.of(card));

        mockMvc.perform(get("/study/block")
                        .param("size", "5")
                        .param("subject", "torts")
                        .param("includeReview", "false")
                        .param("difficulty", "3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.size").value(1))
                .andExpect(jsonPath("$.cards[0].id").value(card.id().toString()));
    }

    @Test
    void getBlock_defaultsIncludeBothPartitions() throws Exception {
        when(blockService.getStudyBlock(isNull(), isNull(), eq(true), eq(true), isNull())).thenReturn(List.of());

        mockMvc.perform(get("/study/block"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.size").value(0));
    }

    @Test
    void getBlock_nonPositiveSizeIs400() throws Exception {
        when(blockService.getStudyBlock(eq(0), any(), anyBoolean(), anyBoolean(), any()))
                .thenThrow(new ValidationException("blockSize", "Block size must be positive, got 0"));

        mockMvc.perform(get("/study/block").param("size", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("blockSize"));
    }
}
