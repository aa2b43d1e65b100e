package app.lexrecall.core.block.controller;

import app.lexrecall.core.block.StudyBlockService;
import app.lexrecall.core.block.controller.dto.StudyBlockResponse;
import app.lexrecall.core.card.controller.dto.CardResponse;
import app.lexrecall.core.card.domain.Subject;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/study")
public class StudyBlockController {

    private final StudyBlockService blockService;

    public StudyBlockController(StudyBlockService blockService) {
        this.blockService = blockService;
    }

    // GET /study/block?size=20&subject=torts&includeNew=true&includeReview=true&difficulty=3
    @GetMapping("/block")
    public StudyBlockResponse getBlock(@RequestParam(required = false) Integer size,
                                       @RequestParam(required = false) String subject,
                                       @RequestParam(defaultValue = "true") boolean includeNew,
                                       @RequestParam(defaultValue = "true") boolean includeReview,
                                       @RequestParam(required = false) Integer difficulty) {
        Subject filter = (subject == null || subject.isBlank()) ? null : Subject.fromCode(subject);
        var cards = blockService.getStudyBlock(size, filter, includeNew, includeReview, difficulty)
                .stream()
                .map(CardResponse::from)
                .toList();
        return new StudyBlockResponse(cards.size(), cards);
    }
}
