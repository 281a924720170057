package signals.demo.starter;

import signals.UnarySignal;

public class LevelLoaded extends UnarySignal<String> {
}
