package com.vidnyan.j2py.application.service;

import lombok.Value;

import java.util.List;

/**
 * Python text produced for one unit, plus the warnings raised while producing it.
 */
@Value(staticConstructor = "of")
public class GeneratedSource {
    String text;
    List<String> warnings;
}
