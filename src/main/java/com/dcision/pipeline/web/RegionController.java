package com.dcision.pipeline.web;

import com.dcision.pipeline.routing.RegionHealthSnapshot;
import com.dcision.pipeline.routing.RegionRouter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/regions")
@RequiredArgsConstructor
public class RegionController {

    private final RegionRouter regionRouter;

    @GetMapping
    public ResponseEntity<List<RegionHealthSnapshot>> regions() {
        return ResponseEntity.ok(regionRouter.snapshot());
    }
}
