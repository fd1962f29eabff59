package com.mergington.activities.controller;

import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;

/**
 * Sends browsers to the static front-end.
 */
@Controller
public class HomeController {

    @GetMapping("/")
    public String home() {
        return "redirect:/static/index.html";
    }
}
