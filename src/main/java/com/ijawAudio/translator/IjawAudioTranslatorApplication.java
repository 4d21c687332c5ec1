package com.ijawAudio.translator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IjawAudioTranslatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(IjawAudioTranslatorApplication.class, args);
    }
}
