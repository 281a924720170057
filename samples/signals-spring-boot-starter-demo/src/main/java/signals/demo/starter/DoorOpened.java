package signals.demo.starter;

import signals.BinarySignal;

/**
 * A door was opened. Arguments: door name, whether the door is locked.
 */
public class DoorOpened extends BinarySignal<String, Boolean> {
}
