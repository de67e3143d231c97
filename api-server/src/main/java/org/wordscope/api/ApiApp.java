package org.wordscope.api;

import org.wordscope.api.bootstrap.ApiBootstrap;

public class ApiApp {
	public static void main(String[] args) {
		ApiBootstrap.run();
	}
}
