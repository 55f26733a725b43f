package com.library.circulation.controller;

import com.library.circulation.controller.dto.BookResponse;
import com.library.circulation.controller.dto.CopiesRequest;
import com.library.circulation.service.CirculationFacade;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/books")
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
public class InventoryController {

    private final CirculationFacade circulationFacade;

    @GetMapping("/{id}")
    public BookResponse getBook(@PathVariable Long id) {
        return BookResponse.from(circulationFacade.getBook(id));
    }

    @PostMapping("/{id}/copies")
    public BookResponse addCopies(@PathVariable Long id, @Valid @RequestBody CopiesRequest request) {
        return BookResponse.from(circulationFacade.addCopies(id, request.count()));
    }

    @DeleteMapping("/{id}")
    public BookResponse retireBook(@PathVariable Long id) {
        return BookResponse.from(circulationFacade.retireBook(id));
    }
}
