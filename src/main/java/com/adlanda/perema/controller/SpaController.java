package com.adlanda.perema.controller;

import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;

/**
 * Serves the single-page frontend for its client-side routes.
 */
@Controller
public class SpaController {

    @GetMapping({"/contacts", "/contacts/**"})
    public String forwardToIndex() {
        return "forward:/index.html";
    }
}
