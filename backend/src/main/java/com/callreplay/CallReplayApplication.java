package com.callreplay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Call Replay Analyzer - screens bot call transcripts and analyzes suspected failures.
 */
@SpringBootApplication
public class CallReplayApplication {

	public static void main(String[] args) {
		SpringApplication.run(CallReplayApplication.class, args);
	}

}
